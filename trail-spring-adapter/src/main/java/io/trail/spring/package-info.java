/**
 * Spring transaction integration.
 *
 * <p>{@link io.trail.spring.SpringTransactionRunner} runs trail plans through a
 * {@link org.springframework.transaction.PlatformTransactionManager}, joining the
 * caller's transaction with a savepoint when one is active.
 *
 * @see io.trail.spring.SpringTransactionRunner
 * @see io.trail.spring.SpringTxContext
 */
package io.trail.spring;
