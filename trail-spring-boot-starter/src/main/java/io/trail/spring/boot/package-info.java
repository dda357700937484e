/**
 * Spring Boot auto-configuration for change versioning.
 *
 * @see io.trail.spring.boot.TrailAutoConfiguration
 * @see io.trail.spring.boot.TrailProperties
 */
package io.trail.spring.boot;
