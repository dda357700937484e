/**
 * Entities, change sets and versions.
 */
package io.trail.model;
