/**
 * REST controllers for operating the pipeline.
 */
package com.phillippitts.streamtalker.presentation.controller;
