/**
 * Per-connection window assembly: turns an unbounded sample stream into overlapping
 * fixed-length analysis windows.
 */
package com.phillippitts.spoofstream.service.audio.window;
