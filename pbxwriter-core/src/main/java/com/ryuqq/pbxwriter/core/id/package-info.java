/**
 * Object identifier assignment.
 *
 * <p>{@link com.ryuqq.pbxwriter.core.id.ObjectIdRegistry} hands out the 24-character
 * identifiers used by every PBX object:</p>
 *
 * <ul>
 *   <li><strong>Content-addressed</strong> ({@code 02...}): truncated SHA-256 of a hashing key, cached per run</li>
 *   <li><strong>Sequence-addressed</strong> ({@code 01...}): zero-padded monotonic counter, resettable</li>
 * </ul>
 *
 * @since 1.0.0
 * @author PBX Writer Team
 */
package com.ryuqq.pbxwriter.core.id;
