/**
 * Domain model for call records, stage statuses and lead analyses.
 *
 * <p>All types are immutable records or enums. They carry no persistence or transport
 * concerns beyond the JSON shape in {@link com.phillippitts.callintel.domain.LeadAnalysisJson}.
 */
package com.phillippitts.callintel.domain;
