/**
 * Request and response bodies of the control API.
 */
package com.phillippitts.streamtalker.presentation.dto;
