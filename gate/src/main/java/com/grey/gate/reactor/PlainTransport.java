/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.reactor;

public class PlainTransport
	implements StreamTransport
{
	private final java.nio.channels.SocketChannel chan;
	private final XmitQueue xmtq = new XmitQueue();

	public PlainTransport(java.nio.channels.SocketChannel chan)
	{
		this.chan = chan;
	}

	@Override
	public int read(java.nio.ByteBuffer dst) throws java.io.IOException
	{
		return chan.read(dst);
	}

	@Override
	public void write(java.nio.ByteBuffer src) throws java.io.IOException
	{
		xmtq.write(chan, src);
	}

	@Override
	public boolean flush() throws java.io.IOException
	{
		return xmtq.drain(chan);
	}

	@Override
	public boolean isIdle() {return !xmtq.isBlocked();}

	@Override
	public boolean isSecure() {return false;}

	@Override
	public java.nio.channels.SocketChannel getChannel() {return chan;}

	@Override
	public void close()
	{
		xmtq.clear();
	}
}
