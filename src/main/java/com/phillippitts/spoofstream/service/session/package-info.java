/**
 * Connection sessions, the protocol state machine that drives them, and the registry of
 * live connections.
 */
package com.phillippitts.spoofstream.service.session;
