/**
 * Mapping of pipeline exceptions to HTTP responses.
 */
package com.phillippitts.streamtalker.presentation.exception;
