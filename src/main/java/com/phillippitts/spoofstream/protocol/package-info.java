/**
 * JSON wire protocol: tagged inbound messages, their decoder, and outbound message builders.
 */
package com.phillippitts.spoofstream.protocol;
