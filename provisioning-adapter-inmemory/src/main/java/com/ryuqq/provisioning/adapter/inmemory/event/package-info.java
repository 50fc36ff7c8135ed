/**
 * In-memory event log for tests and local runs.
 *
 * <p>Rows are kept in their serialized JSON form so that every read goes through the same
 * {@link com.ryuqq.provisioning.core.event.EventSerializer} a database adapter would use.
 * Appends are serialized by a single monitor, which gives a gap-free global sequence and
 * optimistic per-stream version checks.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
package com.ryuqq.provisioning.adapter.inmemory.event;
