/**
 * Logging context helpers for the control API.
 */
package com.phillippitts.streamtalker.config.logging;
