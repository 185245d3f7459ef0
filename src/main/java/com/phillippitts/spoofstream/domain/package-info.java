/**
 * Domain values shared by the streaming core.
 *
 * <ul>
 *   <li>{@link com.phillippitts.spoofstream.domain.SampleSequence} - decoded audio for one chunk</li>
 *   <li>{@link com.phillippitts.spoofstream.domain.DetectionResult} - verdict for one window</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.spoofstream.domain;
