/*
 * Copyright 2012-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.echo;

import com.grey.gate.base.config.XmlConfig;
import com.grey.gate.reactor.Dispatcher;
import com.grey.gate.server.ConnectionHandler;
import com.grey.gate.server.GateServer;
import com.grey.gate.server.HandlerFactory;

public class EchoFactory
	implements HandlerFactory
{
	public static final String DFLT_GREETING = "Welcome to the GreyGate echo service";
	public static final String DFLT_QUIT = "quit";

	private final String greeting;
	private final String quitCommand;
	private final java.util.concurrent.atomic.AtomicInteger sessions = new java.util.concurrent.atomic.AtomicInteger();
	private final java.util.concurrent.atomic.AtomicInteger activeSessions = new java.util.concurrent.atomic.AtomicInteger();

	public String getGreeting() {return greeting;}
	public String getQuitCommand() {return quitCommand;}
	public int getSessionCount() {return sessions.get();}
	public int getActiveSessions() {return activeSessions.get();}

	public EchoFactory() {
		this(DFLT_GREETING, DFLT_QUIT);
	}

	public EchoFactory(XmlConfig cfg) {
		this(cfg.getValue("greeting", false, DFLT_GREETING), cfg.getValue("quit", false, DFLT_QUIT));
	}

	public EchoFactory(String greeting, String quitCommand) {
		this.greeting = greeting;
		this.quitCommand = quitCommand;
	}

	// called on the Dispatcher threads
	void sessionStarted() {
		sessions.incrementAndGet();
		activeSessions.incrementAndGet();
	}

	void sessionEnded() {
		activeSessions.decrementAndGet();
	}

	@Override
	public ConnectionHandler createHandler(java.nio.channels.SocketChannel sock, GateServer srvr, Dispatcher d) throws java.io.IOException {
		return new EchoHandler(sock, srvr, d, this);
	}

	@Override
	public String toString() {
		return super.toString()+" with greeting="+greeting+", quit="+quitCommand;
	}
}
