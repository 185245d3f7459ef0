/**
 * Spring wiring: executors, classifier backend, WebSocket endpoint.
 * Typed settings live in {@code config.properties}.
 */
package com.phillippitts.spoofstream.config;
