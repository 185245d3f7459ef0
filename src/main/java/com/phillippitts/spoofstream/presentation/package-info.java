/**
 * Outer surfaces: WebSocket transport and HTTP controllers.
 */
package com.phillippitts.spoofstream.presentation;
