/**
 * Closed-loop sensitivity tuning from alert-outcome feedback.
 *
 * @since 1.0.0
 */
package com.adaptivesentinel.core.feedback;
