/**
 * Application-specific exception hierarchy.
 *
 * <p>Every failure the streaming core can report to a client is an unchecked subclass of
 * {@link com.phillippitts.spoofstream.exception.SpoofStreamException}. The protocol handler
 * catches them at the connection boundary and turns each into exactly one {@code error}
 * message, so no failure on one connection leaks into another.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.spoofstream.exception.MalformedPayloadException} - audio payload
 *       cannot be decoded</li>
 *   <li>{@link com.phillippitts.spoofstream.exception.UnsupportedAudioEncodingException} - unknown
 *       encoding tag</li>
 *   <li>{@link com.phillippitts.spoofstream.exception.SampleRateMismatchException} - declared rate
 *       differs from the committed one</li>
 *   <li>{@link com.phillippitts.spoofstream.exception.DuplicateConnectionException} - client id
 *       already live</li>
 *   <li>{@link com.phillippitts.spoofstream.exception.ModelUnavailableException} - classifier not
 *       ready</li>
 *   <li>{@link com.phillippitts.spoofstream.exception.InferenceException} - classifier failed on a
 *       window</li>
 *   <li>{@link com.phillippitts.spoofstream.exception.ProtocolViolationException} - not a valid
 *       protocol message</li>
 *   <li>{@link com.phillippitts.spoofstream.exception.TransportFailureException} - connection
 *       dropped</li>
 *   <li>{@link com.phillippitts.spoofstream.exception.InvalidWindowConfigException} - window
 *       lengths cannot advance</li>
 * </ul>
 *
 * @see com.phillippitts.spoofstream.service.session.StreamProtocolHandler
 * @since 1.0
 */
package com.phillippitts.spoofstream.exception;
