/**
 * Streaming session lifecycle.
 *
 * <p>{@link com.phillippitts.speechstream.service.session.SessionRegistry} owns the id-to-session
 * map; {@link com.phillippitts.speechstream.service.session.StreamingSessionCoordinator} drives
 * sessions from first fragment to end-of-utterance;
 * {@link com.phillippitts.speechstream.service.session.IdleSessionSweeper} optionally evicts
 * abandoned ones.
 */
package com.phillippitts.speechstream.service.session;
