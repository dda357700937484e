/**
 * Transactional change-versioning: every insert, update, delete or bulk mutation of a
 * tracked entity commits together with the version that records it.
 *
 * @see io.trail.Trail
 * @see io.trail.multi.TrailMulti
 */
package io.trail;
