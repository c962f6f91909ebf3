/*
 * Copyright 2010-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.reactor;

import com.grey.gate.base.config.SysProps;

/**
 * Backlog of outgoing data that a non-blocking channel was not ready to accept.
 */
class XmitQueue
{
	static final int MAXBUFSIZ = SysProps.get("greygate.io.xmtqbufsiz", 64*1024);

	private final java.util.ArrayDeque<java.nio.ByteBuffer> xmtq = new java.util.ArrayDeque<>();

	public boolean isBlocked() {return !xmtq.isEmpty();}

	// This method writes data in the range position() to limit() and on return the buffer has been fully consumed,
	// either by the channel or by being copied onto the queue.
	void write(java.nio.channels.WritableByteChannel chan, java.nio.ByteBuffer xmtbuf) throws java.io.IOException
	{
		if (isBlocked()) {
			//preserve the ordering by appending to the existing backlog
			enqueue(xmtbuf);
			return;
		}
		chan.write(xmtbuf);
		if (xmtbuf.hasRemaining()) enqueue(xmtbuf);
	}

	// Returns true if the backlog has been fully drained
	boolean drain(java.nio.channels.WritableByteChannel chan) throws java.io.IOException
	{
		while (!xmtq.isEmpty()) {
			java.nio.ByteBuffer buf = xmtq.peek();
			chan.write(buf);
			if (buf.hasRemaining()) return false;
			xmtq.remove();
		}
		return true;
	}

	void clear()
	{
		xmtq.clear();
	}

	private void enqueue(java.nio.ByteBuffer databuf)
	{
		while (databuf.hasRemaining()) {
			int chunk = Math.min(databuf.remaining(), MAXBUFSIZ);
			java.nio.ByteBuffer qbuf = java.nio.ByteBuffer.allocate(chunk);
			int lmt = databuf.limit();
			databuf.limit(databuf.position() + chunk);
			qbuf.put(databuf);
			databuf.limit(lmt);
			qbuf.flip();
			xmtq.add(qbuf);
		}
	}
}
