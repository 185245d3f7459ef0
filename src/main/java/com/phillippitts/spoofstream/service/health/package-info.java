/**
 * Actuator health contributions.
 */
package com.phillippitts.spoofstream.service.health;
