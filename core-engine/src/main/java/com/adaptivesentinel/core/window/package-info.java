/**
 * Time-evicting sample windows and their summary statistics.
 *
 * @since 1.0.0
 */
package com.adaptivesentinel.core.window;
