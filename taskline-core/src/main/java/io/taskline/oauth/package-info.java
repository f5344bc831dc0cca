/**
 * CSRF {@code state} values for the OAuth authorization-code flow.
 */
package io.taskline.oauth;
