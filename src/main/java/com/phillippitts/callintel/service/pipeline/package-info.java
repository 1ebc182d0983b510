/**
 * Pipeline entry point and operational monitoring.
 */
package com.phillippitts.callintel.service.pipeline;
