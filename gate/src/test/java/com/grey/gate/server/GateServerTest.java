/*
 * Copyright 2014-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.server;

import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

import com.grey.gate.errors.GateBindException;
import com.grey.gate.errors.GateConfigException;
import com.grey.gate.reactor.Dispatcher;
import com.grey.gate.reactor.config.DispatcherConfig;
import com.grey.gate.reactor.config.SSLConfig;
import com.grey.gate.server.config.ServerConfig;
import com.grey.gate.logging.Logger;
import com.grey.gate.logging.MemLogger;

public class GateServerTest
{
	private static final long TMT_WAIT = 10_000;

	private final java.util.List<java.net.Socket> clients = new java.util.ArrayList<>();
	private Dispatcher dsptch;
	private GateServer server;

	@org.junit.After
	public void teardown() throws java.io.IOException {
		for (java.net.Socket sock : clients) sock.close();
		if (server != null && server.getState() != GateServer.STATE.CLOSED && !server.getDispatcher().isLooping()) server.closeAll();
	}

	@org.junit.Test
	public void testMaxConns() throws Exception
	{
		ProbeHandlerFactory fact = new ProbeHandlerFactory();
		server = createServer("maxconns", 2, 0, fact, null);

		java.net.Socket c1 = connect();
		pump(() -> fact.handled.get() == 1);
		java.net.Socket c2 = connect();
		pump(() -> fact.handled.get() == 2);
		org.junit.Assert.assertEquals(2, server.getRegistrySize());

		java.net.Socket c3 = connect();
		pump(() -> fact.rejectedMax.get() == 1 && fact.closed.get() == 1);
		org.junit.Assert.assertEquals(ConnectionHandler.MSG_MAXCONS, readLine(c3));
		org.junit.Assert.assertEquals(-1, c3.getInputStream().read());

		org.junit.Assert.assertEquals(ProbeHandlerFactory.GREETING, readLine(c1));
		org.junit.Assert.assertEquals(ProbeHandlerFactory.GREETING, readLine(c2));
		org.junit.Assert.assertEquals(2, fact.handled.get());
		org.junit.Assert.assertEquals(0, fact.rejectedPerIp.get());
		org.junit.Assert.assertEquals(2, server.getRegistrySize());
		org.junit.Assert.assertEquals(2, server.getAdmissionControl().size());

		// a slot frees up once an admitted client goes away
		c1.close();
		pump(() -> fact.closed.get() == 2);
		java.net.Socket c4 = connect();
		pump(() -> fact.handled.get() == 3);
		org.junit.Assert.assertEquals(ProbeHandlerFactory.GREETING, readLine(c4));
		org.junit.Assert.assertEquals(1, fact.rejectedMax.get());
	}

	@org.junit.Test
	public void testMaxConnsPerIP() throws Exception
	{
		ProbeHandlerFactory fact = new ProbeHandlerFactory();
		server = createServer("maxconns_per_ip", 0, 1, fact, null);

		java.net.Socket c1 = connect();
		pump(() -> fact.handled.get() == 1);
		java.net.Socket c2 = connect();
		pump(() -> fact.rejectedPerIp.get() == 1 && fact.closed.get() == 1);
		org.junit.Assert.assertEquals(ProbeHandlerFactory.GREETING, readLine(c1));
		org.junit.Assert.assertEquals(ConnectionHandler.MSG_MAXCONS_PER_IP, readLine(c2));
		org.junit.Assert.assertEquals(-1, c2.getInputStream().read());
		org.junit.Assert.assertEquals(1, server.getAdmissionControl().getCount("127.0.0.1"));
		org.junit.Assert.assertEquals(0, fact.rejectedMax.get());
		org.junit.Assert.assertEquals(1, server.getRegistrySize());
	}

	@org.junit.Test
	public void testUnlimited() throws Exception
	{
		int cnt = 10;
		ProbeHandlerFactory fact = new ProbeHandlerFactory();
		server = createServer("unlimited", 0, 0, fact, null);
		for (int idx = 0; idx != cnt; idx++) {
			connect();
		}
		pump(() -> fact.handled.get() == cnt);
		for (java.net.Socket c : clients) {
			org.junit.Assert.assertEquals(ProbeHandlerFactory.GREETING, readLine(c));
		}
		org.junit.Assert.assertEquals(0, fact.rejectedMax.get() + fact.rejectedPerIp.get());
		org.junit.Assert.assertEquals(cnt, server.getRegistrySize());
		org.junit.Assert.assertEquals(cnt, server.getAdmissionControl().getCount("127.0.0.1"));
	}

	@org.junit.Test
	public void testEcho() throws Exception
	{
		ProbeHandlerFactory fact = new ProbeHandlerFactory();
		server = createServer("echo", 0, 0, fact, null);
		java.net.Socket c = connect();
		pump(() -> fact.handled.get() == 1);
		org.junit.Assert.assertEquals(ProbeHandlerFactory.GREETING, readLine(c));
		c.getOutputStream().write("ping\r\n".getBytes(java.nio.charset.StandardCharsets.UTF_8));
		c.getOutputStream().flush();
		pump(() -> c.getInputStream().available() >= 6);
		org.junit.Assert.assertEquals("ping", readLine(c));
	}

	@org.junit.Test
	public void testHandleFailure() throws Exception
	{
		ProbeHandlerFactory fact = new ProbeHandlerFactory();
		server = createServer("handlefail", 0, 0, fact, null);
		connect();
		pump(() -> fact.handled.get() == 1);
		int regsize = server.getRegistrySize();

		fact.failHandle = true;
		java.net.Socket c2 = connect();
		pump(() -> fact.errors.get() == 1 && fact.closed.get() == 1);
		org.junit.Assert.assertEquals(-1, c2.getInputStream().read());
		org.junit.Assert.assertEquals(regsize, server.getRegistrySize());
		org.junit.Assert.assertEquals(1, server.getAdmissionControl().size());

		// the server carries on serving unrelated connections
		fact.failHandle = false;
		java.net.Socket c3 = connect();
		pump(() -> fact.handled.get() == 3);
		org.junit.Assert.assertEquals(ProbeHandlerFactory.GREETING, readLine(c3));
		org.junit.Assert.assertEquals(1, fact.errors.get());
		org.junit.Assert.assertTrue(server.isServing());
	}

	@org.junit.Test
	public void testHandlerConstructionFailure() throws Exception
	{
		Logger log = Mockito.mock(Logger.class);
		ProbeHandlerFactory fact = new ProbeHandlerFactory();
		fact.failCreate = true;
		server = createServer("createfail", 0, 0, fact, null, log);
		java.net.Socket c = connect();
		pump(() -> { try { return c.getInputStream().read() == -1; } catch (java.net.SocketTimeoutException ex) { return false; } }, 10);

		Mockito.verify(log).log(ArgumentMatchers.eq(Logger.LEVEL.ERR), ArgumentMatchers.any(IllegalStateException.class),
				ArgumentMatchers.eq(true), ArgumentMatchers.any(CharSequence.class));
		org.junit.Assert.assertEquals(0, server.getAdmissionControl().size());
		org.junit.Assert.assertEquals(0, server.getRegistrySize());
		org.junit.Assert.assertEquals(0, fact.handled.get() + fact.errors.get() + fact.closed.get());
		org.junit.Assert.assertTrue(server.isServing());
	}

	@org.junit.Test
	public void testLostConnection() throws Exception
	{
		ProbeHandlerFactory fact = new ProbeHandlerFactory();
		server = createServer("lost", 0, 0, fact, null);
		java.nio.channels.SocketChannel sock = java.nio.channels.SocketChannel.open();
		server.handleAccepted(sock, null);
		org.junit.Assert.assertFalse(sock.isOpen());
		org.junit.Assert.assertEquals(1, fact.created.get());
		org.junit.Assert.assertFalse(fact.handlers.get(0).isConnected());
		org.junit.Assert.assertEquals(0, fact.handled.get() + fact.errors.get() + fact.closed.get());
		org.junit.Assert.assertEquals(0, server.getAdmissionControl().size());
		org.junit.Assert.assertEquals(0, server.getRegistrySize());
	}

	@org.junit.Test
	public void testCloseAll() throws Exception
	{
		ProbeHandlerFactory fact = new ProbeHandlerFactory();
		server = createServer("closeall", 0, 0, fact, null);
		for (int idx = 0; idx != 3; idx++) {
			connect();
		}
		pump(() -> fact.handled.get() == 3);
		server.closeAll();
		org.junit.Assert.assertEquals(GateServer.STATE.CLOSED, server.getState());
		org.junit.Assert.assertEquals(3, fact.closed.get());
		for (ProbeHandlerFactory.ProbeHandler h : fact.handlers) {
			org.junit.Assert.assertEquals(1, h.getCloseCount());
		}
		org.junit.Assert.assertEquals(0, dsptch.registeredChannelCount());
		org.junit.Assert.assertEquals(0, server.getAdmissionControl().size());
		org.junit.Assert.assertTrue(dsptch.isClosed());
		for (java.net.Socket c : clients) {
			org.junit.Assert.assertEquals(ProbeHandlerFactory.GREETING, readLine(c));
			org.junit.Assert.assertEquals(-1, c.getInputStream().read());
		}

		server.closeAll();
		server.close();
		org.junit.Assert.assertEquals(3, fact.closed.get());
		try {
			server.serve(100, false, false, 1);
			org.junit.Assert.fail("Closed server was allowed to serve");
		} catch (IllegalStateException ex) {
			org.junit.Assert.assertEquals(GateServer.STATE.CLOSED, server.getState());
		}
	}

	@org.junit.Test
	public void testPreforkNonBlocking() throws Exception
	{
		server = createServer("prefork", 0, 0, new ProbeHandlerFactory(), null);
		try {
			server.serve(100, false, false, 2);
			org.junit.Assert.fail("Prefork was allowed with non-blocking serve");
		} catch (GateConfigException ex) {
			org.junit.Assert.assertEquals(GateServer.STATE.BOUND, server.getState());
			org.junit.Assert.assertNull(server.getWorkerPool());
		}
	}

	@org.junit.Test
	public void testStartupLog() throws Exception
	{
		MemLogger log = new MemLogger("startup");
		ProbeHandlerFactory fact = new ProbeHandlerFactory();
		server = createServer("startlog", 0, 0, fact, null, log);
		org.junit.Assert.assertEquals(GateServer.STATE.BOUND, server.getState());
		server.serve(10, false, false, 1);
		server.serve(10, false, false, 1);
		String txt = log.get();
		String banner = ">>> starting startlog server on ";
		org.junit.Assert.assertTrue(txt, txt.contains(banner));
		org.junit.Assert.assertEquals(txt, txt.indexOf(banner), txt.lastIndexOf(banner));
		org.junit.Assert.assertTrue(server.isServing());
	}

	@org.junit.Test
	public void testSecureTransport() throws Exception
	{
		MemLogger log = new MemLogger("ssl");
		SSLConfig sslcfg = new SSLConfig.Builder().withStorePath(null).withTrustPath(null).withXmlConfig(getSection("tls", "ssl")).build();
		ProbeHandlerFactory fact = new ProbeHandlerFactory();
		server = createServer("secure", 1, 0, fact, sslcfg, log);
		ServeThread thrd = new ServeThread(server, true);
		thrd.start();
		waitFor(() -> dsptch.isLooping());

		// the greeting is held back until the handshake completes, so it arrives as application data
		javax.net.ssl.SSLSocket c1 = connectSSL();
		org.junit.Assert.assertEquals(ProbeHandlerFactory.GREETING, readLine(c1));
		org.junit.Assert.assertEquals("TLSv1.2", c1.getSession().getProtocol());
		org.junit.Assert.assertTrue(fact.handlers.get(0).getTransport().isSecure());
		c1.getOutputStream().write("ping\r\n".getBytes(java.nio.charset.StandardCharsets.UTF_8));
		c1.getOutputStream().flush();
		org.junit.Assert.assertEquals("ping", readLine(c1));

		// the refusal is also delivered over TLS, followed by close_notify
		javax.net.ssl.SSLSocket c2 = connectSSL();
		org.junit.Assert.assertEquals(ConnectionHandler.MSG_MAXCONS, readLine(c2));
		org.junit.Assert.assertEquals(-1, c2.getInputStream().read());
		waitFor(() -> fact.closed.get() == 1);
		org.junit.Assert.assertEquals(1, fact.rejectedMax.get());

		server.shutdown();
		thrd.join(TMT_WAIT);
		org.junit.Assert.assertFalse(thrd.isAlive());
		org.junit.Assert.assertNull(thrd.failure);
		org.junit.Assert.assertEquals(-1, c1.getInputStream().read());
		org.junit.Assert.assertEquals(2, fact.closed.get());
		org.junit.Assert.assertTrue(log.get(), log.get().contains(">>> starting secure+SSL server"));
	}

	@org.junit.Test
	public void testFailedHandlerConstructor() throws Exception
	{
		ProbeHandlerFactory fact = new ProbeHandlerFactory();
		fact.failConstruct = true;
		server = createServer("brokenctor", 2, 0, fact, null);
		java.net.Socket c1 = connect();
		java.net.Socket c2 = connect();
		java.net.Socket c3 = connect();
		pump(() -> fact.brokenConstructions.get() == 3);
		org.junit.Assert.assertEquals(-1, c1.getInputStream().read());
		org.junit.Assert.assertEquals(-1, c2.getInputStream().read());
		org.junit.Assert.assertEquals(-1, c3.getInputStream().read());
		org.junit.Assert.assertEquals(0, server.getRegistrySize());
		org.junit.Assert.assertEquals(1, dsptch.registeredChannelCount());
		org.junit.Assert.assertEquals(0, server.getAdmissionControl().size());

		// the broken connections have not used up any capacity
		fact.failConstruct = false;
		java.net.Socket c4 = connect();
		java.net.Socket c5 = connect();
		pump(() -> fact.handled.get() == 2);
		org.junit.Assert.assertEquals(ProbeHandlerFactory.GREETING, readLine(c4));
		org.junit.Assert.assertEquals(ProbeHandlerFactory.GREETING, readLine(c5));
		org.junit.Assert.assertEquals(0, fact.rejectedMax.get());
		org.junit.Assert.assertEquals(2, server.getRegistrySize());
	}

	@org.junit.Test
	public void testFailedRejection() throws Exception
	{
		Logger log = Mockito.mock(Logger.class);
		ProbeHandlerFactory fact = new ProbeHandlerFactory();
		fact.failReject = true;
		server = createServer("rejectfail", 1, 0, fact, null, log);
		java.net.Socket c1 = connect();
		pump(() -> fact.handled.get() == 1);
		java.net.Socket c2 = connect();
		pump(() -> fact.rejectedMax.get() == 1 && fact.closed.get() == 1);
		org.junit.Assert.assertEquals(-1, c2.getInputStream().read());
		org.junit.Assert.assertEquals(ProbeHandlerFactory.GREETING, readLine(c1));
		org.junit.Assert.assertEquals(1, server.getRegistrySize());
		org.junit.Assert.assertEquals(1, server.getAdmissionControl().size());
		Mockito.verify(log, Mockito.never()).log(ArgumentMatchers.eq(Logger.LEVEL.ERR), ArgumentMatchers.any(Throwable.class),
				ArgumentMatchers.anyBoolean(), ArgumentMatchers.any(CharSequence.class));
		org.junit.Assert.assertTrue(server.isServing());
	}

	@org.junit.Test
	public void testBindConflict() throws Exception
	{
		server = createServer("first", 0, 0, new ProbeHandlerFactory(), null);
		ServerConfig cfg = new ServerConfig.Builder()
				.withName("second")
				.withInterface("127.0.0.1")
				.withPort(server.getAddress().getPort())
				.build();
		Dispatcher d2 = Dispatcher.create(DispatcherConfig.builder().withName("bindconflict").build());
		try {
			GateServer.create(d2, cfg, new ProbeHandlerFactory());
			org.junit.Assert.fail("Bound to port in use");
		} catch (GateBindException ex) {
			org.junit.Assert.assertEquals(server.getAddress().getPort(), ex.getAddress().getPort());
			org.junit.Assert.assertEquals(0, d2.registeredChannelCount());
		} finally {
			d2.closeAll();
		}
	}

	@org.junit.Test
	public void testAdoptedSocket() throws Exception
	{
		dsptch = Dispatcher.create(DispatcherConfig.builder().withName("adopted").build());
		ServerConfig cfg = new ServerConfig.Builder().withName("adopted").build();
		java.nio.channels.ServerSocketChannel chan = java.nio.channels.ServerSocketChannel.open();
		try {
			GateServer.create(dsptch, chan, cfg, new ProbeHandlerFactory());
			org.junit.Assert.fail("Adopted an unbound socket");
		} catch (GateBindException ex) {
			org.junit.Assert.assertNull(ex.getAddress());
		}
		chan.close();
		try {
			GateServer.create(dsptch, chan, cfg, new ProbeHandlerFactory());
			org.junit.Assert.fail("Adopted a closed socket");
		} catch (GateBindException ex) {
			org.junit.Assert.assertNull(ex.getAddress());
		}

		chan = java.nio.channels.ServerSocketChannel.open();
		chan.bind(new java.net.InetSocketAddress("127.0.0.1", 0));
		ProbeHandlerFactory fact = new ProbeHandlerFactory();
		server = GateServer.create(dsptch, chan, cfg, fact);
		org.junit.Assert.assertEquals(chan.getLocalAddress(), server.getAddress());
		connect();
		pump(() -> fact.handled.get() == 1);
		server.closeAll();
		org.junit.Assert.assertFalse(chan.isOpen());
	}

	@org.junit.Test
	public void testShutdownFromOtherThread() throws Exception
	{
		ProbeHandlerFactory fact = new ProbeHandlerFactory();
		server = createServer("shutdown", 0, 0, fact, null);
		ServeThread thrd = new ServeThread(server, true);
		thrd.start();
		waitFor(() -> dsptch.isLooping());
		java.net.Socket c = connect();
		org.junit.Assert.assertEquals(ProbeHandlerFactory.GREETING, readLine(c));

		server.shutdown();
		thrd.join(TMT_WAIT);
		org.junit.Assert.assertFalse(thrd.isAlive());
		org.junit.Assert.assertNull(thrd.failure);
		org.junit.Assert.assertEquals(GateServer.STATE.CLOSED, server.getState());
		org.junit.Assert.assertEquals(1, fact.closed.get());
		org.junit.Assert.assertEquals(-1, c.getInputStream().read());
	}

	@org.junit.Test
	public void testHandledInterrupt() throws Exception
	{
		MemLogger log = new MemLogger("interrupt");
		server = createServer("interrupt", 0, 0, new ProbeHandlerFactory(), null, log);
		ServeThread thrd = new ServeThread(server, true);
		thrd.start();
		waitFor(() -> server.isServing());
		thrd.interrupt();
		thrd.join(TMT_WAIT);
		org.junit.Assert.assertFalse(thrd.isAlive());
		org.junit.Assert.assertNull(thrd.failure);
		org.junit.Assert.assertEquals(GateServer.STATE.CLOSED, server.getState());
		String txt = log.get();
		org.junit.Assert.assertTrue(txt, txt.contains("received interrupt signal"));
		org.junit.Assert.assertTrue(txt, txt.contains(">>> shutting down server, "));
		org.junit.Assert.assertTrue(txt, txt.contains("concurrency model: async"));
	}

	@org.junit.Test
	public void testUnhandledInterrupt() throws Exception
	{
		server = createServer("nointerrupt", 0, 0, new ProbeHandlerFactory(), null);
		ServeThread thrd = new ServeThread(server, false);
		thrd.start();
		waitFor(() -> server.isServing());
		thrd.interrupt();
		thrd.join(TMT_WAIT);
		org.junit.Assert.assertFalse(thrd.isAlive());
		org.junit.Assert.assertEquals(InterruptedException.class, thrd.failure == null ? null : thrd.failure.getClass());
		org.junit.Assert.assertEquals(GateServer.STATE.SERVING, server.getState());
		server.closeAll();
		org.junit.Assert.assertEquals(GateServer.STATE.CLOSED, server.getState());
	}

	private GateServer createServer(String name, int maxconns, int maxconnsPerIP, HandlerFactory fact, SSLConfig sslcfg) throws java.io.IOException {
		return createServer(name, maxconns, maxconnsPerIP, fact, sslcfg, new MemLogger(name));
	}

	private GateServer createServer(String name, int maxconns, int maxconnsPerIP, HandlerFactory fact, SSLConfig sslcfg, Logger log) throws java.io.IOException {
		DispatcherConfig dcfg = DispatcherConfig.builder()
				.withName(name)
				.withLogger(log)
				.build();
		dsptch = Dispatcher.create(dcfg);
		ServerConfig cfg = new ServerConfig.Builder()
				.withName(name)
				.withInterface("127.0.0.1")
				.withPort(0)
				.withMaxConns(maxconns)
				.withMaxConnsPerIP(maxconnsPerIP)
				.withConfigSSL(sslcfg)
				.build();
		GateServer srvr = GateServer.create(dsptch, cfg, fact);
		org.junit.Assert.assertTrue(srvr.getAddress().getPort() != 0);
		org.junit.Assert.assertEquals(1, dsptch.registeredChannelCount());
		org.junit.Assert.assertEquals(0, srvr.getRegistrySize());
		return srvr;
	}

	private java.net.Socket connect() throws java.io.IOException {
		java.net.Socket sock = new java.net.Socket("127.0.0.1", server.getAddress().getPort());
		sock.setSoTimeout((int)TMT_WAIT);
		clients.add(sock);
		return sock;
	}

	// Runs non-blocking passes of the server on this thread until the condition holds
	private void pump(Condition cond) throws Exception {
		pump(cond, TMT_WAIT);
	}

	private void pump(Condition cond, long sockTimeout) throws Exception {
		for (java.net.Socket c : clients) c.setSoTimeout((int)sockTimeout);
		long limit = System.currentTimeMillis() + TMT_WAIT;
		while (!cond.holds()) {
			if (System.currentTimeMillis() > limit) org.junit.Assert.fail("Timed out waiting on server");
			server.serve(100, false, false, 1);
		}
		for (java.net.Socket c : clients) c.setSoTimeout((int)TMT_WAIT);
	}

	private javax.net.ssl.SSLSocket connectSSL() throws Exception {
		SSLConfig clientcfg = new SSLConfig.Builder()
				.withStorePath(null)
				.withTrustPath(GateServerTest.class.getResource("/keystore.p12"))
				.withTrustFormat(SSLConfig.KSTYPE_PKCS12)
				.withTrustPasswd(getSection("tls", "ssl").getPassword("@kspass", null))
				.build();
		javax.net.ssl.SSLSocket sock = (javax.net.ssl.SSLSocket)clientcfg.getContext().getSocketFactory()
				.createSocket("127.0.0.1", server.getAddress().getPort());
		sock.setSoTimeout((int)TMT_WAIT);
		clients.add(sock);
		return sock;
	}

	private static com.grey.gate.base.config.XmlConfig getSection(String srvname, String section) throws Exception {
		java.net.URL url = GateServerTest.class.getResource("/gate-test.xml");
		String pthnam = new java.io.File(url.toURI()).getCanonicalPath();
		return com.grey.gate.base.config.XmlConfig.getSection(pthnam, "/gate/server[@name='"+srvname+"']/"+section);
	}

	private static void waitFor(Condition cond) throws Exception {
		long limit = System.currentTimeMillis() + TMT_WAIT;
		while (!cond.holds()) {
			if (System.currentTimeMillis() > limit) org.junit.Assert.fail("Timed out waiting on server thread");
			Thread.sleep(10);
		}
	}

	private static String readLine(java.net.Socket sock) throws java.io.IOException {
		java.io.InputStream in = sock.getInputStream();
		StringBuilder sb = new StringBuilder();
		int ch;
		while ((ch = in.read()) != -1 && ch != '\n') {
			if (ch != '\r') sb.append((char)ch);
		}
		return sb.toString();
	}


	@FunctionalInterface
	private interface Condition {
		boolean holds() throws Exception;
	}

	private static class ServeThread extends Thread
	{
		private final GateServer srvr;
		private final boolean handleInterrupt;
		volatile Exception failure;

		ServeThread(GateServer s, boolean h) {
			super("ServeThread-"+s.getName());
			srvr = s;
			handleInterrupt = h;
		}

		@Override
		public void run() {
			try {
				srvr.serve(-1, true, handleInterrupt, 1);
			} catch (Exception ex) {
				failure = ex;
			}
		}
	}
}
