/**
 * Typed {@code @ConfigurationProperties} bound from application.properties and validated
 * at startup.
 */
package com.phillippitts.spoofstream.config.properties;
