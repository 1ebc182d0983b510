/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.callintel.exception.CallIntelException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.callintel.exception.ConfigurationException} - Missing
 *       credential, prompt template or fallback model; never retried</li>
 *   <li>{@link com.phillippitts.callintel.exception.UpstreamException} - Failure reported by
 *       an external collaborator, tagged with an
 *       {@link com.phillippitts.callintel.exception.ErrorCategory} and an error code</li>
 *   <li>{@link com.phillippitts.callintel.exception.PromptNotFoundException} - Prompt template
 *       id unknown to the reasoning service</li>
 *   <li>{@link com.phillippitts.callintel.exception.MalformedResponseException} - Response
 *       without usable text or with invalid JSON</li>
 * </ul>
 *
 * <p>Pipeline stages never let these escape: each stage catches them at its top level and
 * persists the message on the call record.
 *
 * @since 1.0
 */
package com.phillippitts.callintel.exception;
