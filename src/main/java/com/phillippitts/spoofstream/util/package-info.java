/**
 * Small stateless helpers shared across layers.
 */
package com.phillippitts.spoofstream.util;
