/**
 * Application events for diagnostic capture of final upstream failures.
 */
package com.phillippitts.callintel.service.events;
