/**
 * HTTP endpoints alongside the WebSocket: liveness and aggregate statistics.
 */
package com.phillippitts.spoofstream.presentation.controller;
