/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.reactor;

/**
 * The readiness-notification loop that a server runs on.
 * <br>
 * Implementations maintain a registry of active channels and deliver I/O events to them from within
 * {@link #loop(long, boolean)}.
 */
public interface EventLoop
{
	/**
	 * Number of channels currently registered with this loop.
	 */
	int registeredChannelCount();

	/**
	 * Waits for and dispatches I/O events.
	 * @param timeout Upper bound in milliseconds on one wait for readiness. Negative means wait indefinitely and zero means poll.
	 * @param blocking If false, return after one pass. If true, keep going until the registry is empty or a stop is requested.
	 * @throws InterruptedException if the calling thread is interrupted
	 */
	void loop(long timeout, boolean blocking) throws InterruptedException, java.io.IOException;

	/**
	 * Closes every registered channel. Repeated calls have no further effect.
	 */
	void closeAll();
}
