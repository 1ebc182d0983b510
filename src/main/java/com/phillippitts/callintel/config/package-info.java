/**
 * Spring configuration: thread pools, retry policies, HTTP clients and stage wiring.
 */
package com.phillippitts.callintel.config;
