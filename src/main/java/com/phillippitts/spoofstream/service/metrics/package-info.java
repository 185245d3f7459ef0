/**
 * Micrometer instrumentation.
 */
package com.phillippitts.spoofstream.service.metrics;
