/*
 * Copyright 2010-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.reactor;

import com.grey.gate.logging.Logger;
import com.grey.gate.logging.Logger.LEVEL;

/**
 * This is the base class for all entities who wish to monitor an NIO-based I/O channel, and receive
 * event callbacks for it.
 */
public abstract class ChannelMonitor
{
	private final Dispatcher dsptch;
	private final int cm_id;
	private java.nio.channels.SelectableChannel iochan;
	private java.nio.channels.SelectionKey regkey;
	private int regOps; //JDK flags - shadows/mirrors regkey.interestOps()
	private boolean weClose; //we own the channel and must close it
	private boolean inDisconnect;

	protected abstract void ioIndication(int readyOps) throws java.io.IOException;

	/**
	 * Called by the Dispatcher when ioIndication() throws. Default action is to disconnect.
	 */
	protected void eventError(Throwable ex) throws java.io.IOException {disconnect();}

	/**
	 * Called exactly once, at the end of the first disconnect().
	 */
	protected void channelClosed() {}

	public int getCMID() {return cm_id;}
	public Dispatcher getDispatcher() {return dsptch;}
	public java.nio.channels.SelectableChannel getChannel() {return iochan;}
	public boolean isDisconnected() {return inDisconnect;}

	// conveniences to enable shorter references to common methods than via getDispatcher()
	public Logger getLogger() {return getDispatcher().getLogger();}

	java.nio.channels.SelectionKey getRegistrationKey() {return regkey;}
	void setRegistrationKey(java.nio.channels.SelectionKey key) {regkey = key;}

	protected ChannelMonitor(Dispatcher d)
	{
		dsptch = d;
		cm_id = d.allocateChannelId();
	}

	protected void registerChannel(java.nio.channels.SelectableChannel chan, boolean takeOwnership) throws java.io.IOException
	{
		iochan = chan;
		weClose = takeOwnership;
		iochan.configureBlocking(false);
		getDispatcher().registerIO(this);
	}

	/**
	 * Deregisters the channel from the Dispatcher and closes it if we own it.
	 * Returns false if we had already been disconnected.
	 */
	public boolean disconnect()
	{
		//avoid re-entrancy, ie. calling ourself recursively due to a failure in these disconnect ops
		if (inDisconnect) return false;
		inDisconnect = true;

		if (iochan != null) {
			try {
				getDispatcher().deregisterIO(this);
				if (weClose) iochan.close();
			} catch (Exception ex) {
				getLogger().log(LEVEL.ERR, ex, true, "Dispatcher="+getDispatcher().getName()+": Failed to close ChannelMonitor=E"+cm_id+"/"+iochan);
			}
			iochan = null;
		}
		channelClosed();
		return true;
	}

	// We should not receive Read events after disabling OP_READ, and same goes for Write/OP_WRITE, but beware that some IO events could
	// have already fired before we disabled them, and we're just receiving those IO event later on in the same Dispatcher cycle.
	// We therefore have to filter out our current Interest set from the supplied Ready set.
	void handleIO(int readyOps) throws java.io.IOException
	{
		readyOps &= regOps;
		if (readyOps != 0) ioIndication(readyOps);
	}

	protected boolean enableRead() throws java.io.IOException
	{
		return monitorIO(regOps | java.nio.channels.SelectionKey.OP_READ);
	}

	protected boolean enableWrite() throws java.io.IOException
	{
		return monitorIO(regOps | java.nio.channels.SelectionKey.OP_WRITE);
	}

	protected boolean disableWrite() throws java.io.IOException
	{
		return monitorIO(regOps & ~java.nio.channels.SelectionKey.OP_WRITE);
	}

	protected boolean enableListen() throws java.io.IOException
	{
		return monitorIO(regOps | java.nio.channels.SelectionKey.OP_ACCEPT);
	}

	private boolean monitorIO(int opflags) throws java.nio.channels.ClosedChannelException
	{
		if (opflags == regOps || iochan == null) return false;
		regOps = opflags;
		getDispatcher().monitorIO(this, regOps);
		return true;
	}

	@Override
	public String toString() {
		return getClass().getName()+"/E"+getCMID()+" with iochan="+getChannel();
	}
}
