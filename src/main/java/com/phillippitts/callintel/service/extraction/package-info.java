/**
 * Lead-extraction stage: the orchestrator producing individual and complete analyses, and the
 * structured-extraction client for the OpenAI Responses API (prompt templates, default-model
 * fallback, transient retry, output parsing).
 */
package com.phillippitts.callintel.service.extraction;
