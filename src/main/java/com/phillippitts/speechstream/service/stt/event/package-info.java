/**
 * Application events raised by the recognition layer.
 *
 * <p>Events are consumed by {@code ErrorEventsListener}
 * for throttled logging.
 */
package com.phillippitts.speechstream.service.stt.event;
