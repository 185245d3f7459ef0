/**
 * Spring WebSocket transport adapter.
 */
package com.phillippitts.spoofstream.presentation.websocket;
