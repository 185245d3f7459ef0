/**
 * Classifier lifecycle supervision: failure events, bounded restarts and cooldown.
 */
package com.phillippitts.spoofstream.service.detection.watchdog;
