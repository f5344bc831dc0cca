/**
 * OAuth credential lifecycle: on-demand and proactive token refresh, revocation,
 * and per-owner token status.
 *
 * @see io.taskline.credential.TokenRefreshManager
 * @see io.taskline.credential.ProviderRefresher
 */
package io.taskline.credential;
