/**
 * Domain-agnostic retry engine: exponential backoff with jitter, per-attempt timeouts and
 * token- or predicate-based retryability.
 *
 * @since 1.0
 */
package com.phillippitts.callintel.service.retry;
