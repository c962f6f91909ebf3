/*
 * Copyright 2010-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.server;

import com.grey.gate.base.config.SysProps;
import com.grey.gate.errors.GateException;
import com.grey.gate.reactor.ChannelMonitor;
import com.grey.gate.reactor.Dispatcher;
import com.grey.gate.reactor.PlainTransport;
import com.grey.gate.reactor.SSLTransport;
import com.grey.gate.reactor.StreamTransport;
import com.grey.gate.reactor.config.SSLConfig;
import com.grey.gate.logging.Logger.LEVEL;

/**
 * Base class for the protocol handler that owns one accepted connection.
 * <br>
 * The server registers the connection with the Dispatcher once the handler has been fully constructed, and then enables
 * reads, so subclasses receive incoming data via {@link #ioReceived(java.nio.ByteBuffer)}. The server calls
 * {@link #handle()} once the connection has passed admission control, or else one of the rejection callbacks.
 * <br>
 * All methods must be called on the Dispatcher thread.
 */
public abstract class ConnectionHandler
	extends ChannelMonitor
{
	public static final String MSG_MAXCONS = "Too many connections. Service temporarily unavailable.";
	public static final String MSG_MAXCONS_PER_IP = "Too many connections from the same IP address.";
	public static final String EOL = "\r\n";

	static final LEVEL LOGLEVEL_CNX = LEVEL.valueOf(SysProps.get("greygate.cnxlog", LEVEL.TRC.toString()));
	private static final int RCVBUFSIZ = SysProps.get("greygate.io.rcvbufsiz", 16*1024);

	private final GateServer server;
	private final java.net.InetSocketAddress remoteAddress;
	private final StreamTransport transport;
	private final java.nio.ByteBuffer rcvbuf;
	private final java.nio.channels.SocketChannel sockchan;
	private String recordedAddress; //as counted by the server's admission control
	private boolean closePending;

	/**
	 * Entry point for a connection that has passed admission control.
	 */
	public abstract void handle() throws java.io.IOException;

	/**
	 * Delivers incoming data. The buffer's contents are only valid for the duration of the call.
	 */
	protected void ioReceived(java.nio.ByteBuffer data) throws java.io.IOException {}

	/**
	 * Hook that runs once when the connection closes, whatever the cause.
	 */
	protected void handleClose() {}

	public GateServer getServer() {return server;}
	public java.net.InetSocketAddress getRemoteAddress() {return remoteAddress;}
	public StreamTransport getTransport() {return transport;}
	public boolean isConnected() {return remoteAddress != null && !isDisconnected();}

	String getRecordedAddress() {return recordedAddress;}
	void setRecordedAddress(String ip) {recordedAddress = ip;}

	protected ConnectionHandler(java.nio.channels.SocketChannel sock, GateServer srvr, Dispatcher d) throws java.io.IOException
	{
		super(d);
		server = srvr;
		sockchan = sock;
		java.net.SocketAddress addr = (sock.isOpen() && sock.isConnected() ? sock.getRemoteAddress() : null);
		remoteAddress = (java.net.InetSocketAddress)addr;

		if (remoteAddress == null) {
			// peer has already gone, so there is nothing to handle
			transport = null;
			rcvbuf = null;
			if (getLogger().isActive(LOGLEVEL_CNX)) getLogger().log(LOGLEVEL_CNX, "Server="+srvr.getName()+": Connection lost before setup - "+sock);
			sock.close();
			return;
		}
		SSLConfig sslcfg = srvr.getSSLConfig();
		transport = (sslcfg == null ? new PlainTransport(sock) : new SSLTransport(sock, sslcfg));
		rcvbuf = java.nio.ByteBuffer.allocate(RCVBUFSIZ);
	}

	// Registers the connection with the Dispatcher. A subclass constructor may already have queued output.
	void attach() throws java.io.IOException
	{
		registerChannel(sockchan, true);
		enableRead();
		updateWriteState();
	}

	/**
	 * Called if handle() fails. The default logs the error and closes the connection.
	 */
	public void handleError(Throwable ex)
	{
		LEVEL lvl = (GateException.isError(ex) ? LEVEL.ERR : LOGLEVEL_CNX);
		if (getLogger().isActive(lvl)) {
			getLogger().log(lvl, ex, lvl==LEVEL.ERR, "Server="+server.getName()+": Error on connection from "+remoteAddress+" - "+this);
		}
		close();
	}

	/**
	 * Called instead of handle() when the server is at capacity. The default sends a refusal and closes once it is flushed.
	 */
	public void handleMaxCons() throws java.io.IOException
	{
		transmit(MSG_MAXCONS+EOL);
		closeWhenDone();
	}

	/**
	 * Called instead of handle() when the remote address has too many connections.
	 */
	public void handleMaxConsPerIp() throws java.io.IOException
	{
		transmit(MSG_MAXCONS_PER_IP+EOL);
		closeWhenDone();
	}

	public void transmit(CharSequence data) throws java.io.IOException
	{
		transmit(data.toString().getBytes(java.nio.charset.StandardCharsets.UTF_8));
	}

	public void transmit(byte[] data) throws java.io.IOException
	{
		transmit(java.nio.ByteBuffer.wrap(data));
	}

	public void transmit(java.nio.ByteBuffer data) throws java.io.IOException
	{
		if (!isConnected()) throw new java.nio.channels.ClosedChannelException();
		transport.write(data);
		updateWriteState();
	}

	/**
	 * Closes the connection once all pending output has been sent. Any further input is discarded.
	 */
	public void closeWhenDone() throws java.io.IOException
	{
		if (!isConnected()) return;
		closePending = true;
		updateWriteState();
	}

	public void close()
	{
		disconnect();
	}

	@Override
	public boolean disconnect()
	{
		if (isDisconnected()) return false;
		if (transport != null) {
			try {
				transport.close();
			} catch (Exception ex) {
				if (getLogger().isActive(LOGLEVEL_CNX)) {
					getLogger().log(LOGLEVEL_CNX, "Server="+server.getName()+": Transport close failed on "+this+" - "+ex);
				}
			}
		}
		return super.disconnect();
	}

	@Override
	protected final void channelClosed()
	{
		if (recordedAddress != null) {
			server.releaseAddress(recordedAddress);
			recordedAddress = null;
		}
		handleClose();
	}

	@Override
	protected void eventError(Throwable ex)
	{
		handleError(ex);
	}

	/**
	 * Called when the remote peer closes the connection. The default closes our side too.
	 */
	protected void ioDisconnected()
	{
		if (getLogger().isActive(LOGLEVEL_CNX)) getLogger().log(LOGLEVEL_CNX, "Server="+server.getName()+": Remote disconnect on "+this);
		close();
	}

	@Override
	protected void ioIndication(int readyOps) throws java.io.IOException
	{
		if ((readyOps & java.nio.channels.SelectionKey.OP_WRITE) != 0) {
			updateWriteState();
		}
		if ((readyOps & java.nio.channels.SelectionKey.OP_READ) != 0) {
			receiveData();
		}
	}

	private void receiveData() throws java.io.IOException
	{
		// loop until empty, as the transport may be holding decoded data that the socket will not signal again
		while (isConnected()) {
			int nbytes = transport.read(rcvbuf);
			if (nbytes == 0) break;
			if (nbytes == -1) {
				ioDisconnected();
				return;
			}
			rcvbuf.flip();
			if (!closePending) ioReceived(rcvbuf);
			rcvbuf.clear();
		}
		if (isConnected()) updateWriteState(); //a TLS handshake step may have produced output
	}

	private void updateWriteState() throws java.io.IOException
	{
		if (transport.flush()) {
			disableWrite();
			if (closePending && transport.isIdle()) close();
		} else {
			enableWrite();
		}
	}

	@Override
	public String toString() {
		return super.toString()+" from "+remoteAddress;
	}
}
