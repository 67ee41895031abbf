/**
 * Per-session tool state: which tools a session may currently use under its active model,
 * the session's tool configuration and call statistics, and the coordinator that recomputes
 * availability when a session switches models.
 */
package com.obelisk.session;
