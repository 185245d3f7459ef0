/**
 * Window classification: the {@link com.phillippitts.spoofstream.service.detection.AudioClassifier}
 * capability, its lifecycle template, and the invoker that normalizes model output into
 * {@link com.phillippitts.spoofstream.domain.DetectionResult}s.
 */
package com.phillippitts.spoofstream.service.detection;
