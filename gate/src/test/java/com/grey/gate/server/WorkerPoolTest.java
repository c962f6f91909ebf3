/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.server;

import com.grey.gate.reactor.Dispatcher;
import com.grey.gate.reactor.config.DispatcherConfig;
import com.grey.gate.server.config.ServerConfig;
import com.grey.gate.logging.MemLogger;

public class WorkerPoolTest
{
	private static final long TMT_WAIT = 10_000;
	private static final int NUMWORKERS = 2;

	@org.junit.Test
	public void testPrefork() throws Exception
	{
		MemLogger log = new MemLogger("prefork");
		Dispatcher dsptch = Dispatcher.create(DispatcherConfig.builder().withName("prefork").withLogger(log).build());
		ServerConfig cfg = new ServerConfig.Builder()
				.withName("prefork")
				.withInterface("127.0.0.1")
				.withMaxConns(1)
				.build();
		ProbeHandlerFactory fact = new ProbeHandlerFactory();
		GateServer server = GateServer.create(dsptch, cfg, fact);

		java.util.concurrent.atomic.AtomicReference<Exception> failure = new java.util.concurrent.atomic.AtomicReference<>();
		Thread thrd = new Thread(() -> {
			try {
				server.serve(-1, true, true, NUMWORKERS);
			} catch (Exception ex) {
				failure.set(ex);
			}
		}, "PreforkServer");
		thrd.start();

		long limit = System.currentTimeMillis() + TMT_WAIT;
		WorkerPool pool;
		while ((pool = server.getWorkerPool()) == null || pool.getServer(NUMWORKERS-1) == null) {
			org.junit.Assert.assertTrue("Timed out waiting for workers", System.currentTimeMillis() < limit);
			Thread.sleep(10);
		}
		org.junit.Assert.assertEquals(NUMWORKERS, pool.size());
		GateServer w1 = pool.getServer(0);
		GateServer w2 = pool.getServer(1);
		org.junit.Assert.assertNotSame(w1, w2);
		org.junit.Assert.assertNotSame(w1.getAdmissionControl(), w2.getAdmissionControl());
		org.junit.Assert.assertNotSame(w1.getDispatcher(), w2.getDispatcher());
		org.junit.Assert.assertEquals(server.getAddress(), w1.getAddress());
		org.junit.Assert.assertEquals("prefork/prefork-worker1", w1.getName());

		java.net.Socket[] clients = new java.net.Socket[4];
		for (int idx = 0; idx != clients.length; idx++) {
			clients[idx] = new java.net.Socket("127.0.0.1", server.getAddress().getPort());
			clients[idx].setSoTimeout((int)TMT_WAIT);
			org.junit.Assert.assertTrue(readLine(clients[idx]).length() != 0);
		}
		// each worker admits one connection, and whichever worker picks up any others rejects them
		org.junit.Assert.assertTrue(fact.handled.get() <= NUMWORKERS);
		org.junit.Assert.assertEquals(clients.length, fact.handled.get() + fact.rejectedMax.get());

		server.shutdown();
		thrd.join(TMT_WAIT);
		org.junit.Assert.assertFalse(thrd.isAlive());
		org.junit.Assert.assertNull(failure.get());
		org.junit.Assert.assertEquals(GateServer.STATE.CLOSED, server.getState());
		org.junit.Assert.assertEquals(0, pool.getRestarts());
		org.junit.Assert.assertTrue(pool.isStopping());
		org.junit.Assert.assertTrue(w1.getDispatcher().completedOK());
		org.junit.Assert.assertTrue(w2.getDispatcher().completedOK());
		org.junit.Assert.assertEquals(fact.created.get(), fact.closed.get());
		for (java.net.Socket c : clients) {
			while (c.getInputStream().read() != -1) {
				//discard any unread greeting
			}
			c.close();
		}
		String txt = log.get();
		org.junit.Assert.assertTrue(txt, txt.contains("concurrency model: prefork + async (workers="+NUMWORKERS+")"));
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
}
