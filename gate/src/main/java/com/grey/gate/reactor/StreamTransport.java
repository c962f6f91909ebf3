/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.reactor;

/**
 * Moves application data between a connection handler and its non-blocking socket.
 * <br>
 * Writes never block. Whatever the socket cannot take immediately is queued, and the owner is expected to
 * call {@link #flush()} when the socket becomes writable again.
 */
public interface StreamTransport
{
	/**
	 * Reads application data into dst.
	 * @return the number of bytes placed in dst, zero if nothing is available yet, or -1 if the peer has closed the connection
	 */
	int read(java.nio.ByteBuffer dst) throws java.io.IOException;

	/**
	 * Sends or queues all the remaining bytes of src. On return src has been fully consumed.
	 */
	void write(java.nio.ByteBuffer src) throws java.io.IOException;

	/**
	 * Sends as much queued data as the socket will accept.
	 * @return true if nothing remains queued for the socket
	 */
	boolean flush() throws java.io.IOException;

	/**
	 * True if no output of any kind is outstanding.
	 */
	boolean isIdle();

	boolean isSecure();

	/**
	 * Discards pending output and ends the session. This does not close the socket.
	 */
	void close() throws java.io.IOException;

	java.nio.channels.SocketChannel getChannel();
}
