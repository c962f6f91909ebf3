/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.server;

import java.util.concurrent.atomic.AtomicReferenceArray;

import com.grey.gate.base.config.SysProps;
import com.grey.gate.reactor.Dispatcher;
import com.grey.gate.reactor.config.DispatcherConfig;

/**
 * Runs a set of independent worker servers which all accept from the parent server's listening socket.
 * <br>
 * Each worker has its own Dispatcher thread, its own server instance and hence its own admission counters, so
 * connection limits apply per worker. Nothing else is shared.
 */
class WorkerPool
{
	static final int MAX_RESTARTS = SysProps.get("greygate.workers.maxrestarts", 100);
	private static final long TMT_POLL = SysProps.getTime("greygate.workers.pollinterval", "1s");
	private static final long TMT_STOP = SysProps.getTime("greygate.workers.stoptmt", "5s");

	private static class Worker {
		final Dispatcher dsptch;
		final GateServer server;
		final Thread thread;
		Worker(Dispatcher d, GateServer s, Thread t) {dsptch=d; server=s; thread=t;}
	}

	private final GateServer parent;
	private final AtomicReferenceArray<Worker> workers;
	private volatile boolean stopping;
	private int restarts;

	public int size() {return workers.length();}
	public int getRestarts() {return restarts;}
	public boolean isStopping() {return stopping;}

	WorkerPool(GateServer parent, int size)
	{
		this.parent = parent;
		workers = new AtomicReferenceArray<>(size);
	}

	public void start() throws java.io.IOException
	{
		parent.getLogger().info("Server="+parent.getName()+": Starting workers="+size()+" - max-restarts="+MAX_RESTARTS);
		for (int idx = 0; idx != size(); idx++) {
			workers.set(idx, launch(idx));
		}
	}

	/**
	 * Returns the live server instance of the given worker, or null.
	 */
	public GateServer getServer(int idx)
	{
		Worker w = workers.get(idx);
		return (w == null ? null : w.server);
	}

	// Called on the parent's serving thread. Returns once all the workers have terminated and none need restarting.
	public void awaitTermination() throws InterruptedException, java.io.IOException
	{
		for (;;) {
			int alive = 0;
			for (int idx = 0; idx != size(); idx++) {
				Worker w = workers.get(idx);
				if (w == null) continue;
				w.thread.join(TMT_POLL);
				if (w.thread.isAlive()) {
					alive++;
					continue;
				}
				workers.set(idx, null);
				if (!stopping && !w.dsptch.completedOK()) {
					if (restarts == MAX_RESTARTS) {
						parent.getLogger().error("Server="+parent.getName()+": Worker="+w.dsptch.getName()+" failed - restart limit reached="+MAX_RESTARTS);
						continue;
					}
					restarts++;
					parent.getLogger().warn("Server="+parent.getName()+": Worker="+w.dsptch.getName()+" failed - restart="+restarts+"/"+MAX_RESTARTS);
					Worker w2 = launch(idx);
					workers.set(idx, w2);
					if (stopping) w2.dsptch.stop(); //stop() may have run before we stored it
					alive++;
				}
			}
			if (alive == 0) break;
		}
		parent.getLogger().info("Server="+parent.getName()+": All workers have terminated - restarts="+restarts);
	}

	// This method can be called by other threads
	public void stop()
	{
		stopping = true;
		for (int idx = 0; idx != size(); idx++) {
			Worker w = workers.get(idx);
			if (w != null) w.dsptch.stop();
		}
	}

	public void waitStopped()
	{
		for (int idx = 0; idx != size(); idx++) {
			Worker w = workers.get(idx);
			if (w == null) continue;
			Dispatcher.STOPSTATUS status = w.dsptch.waitStopped(TMT_STOP, true);
			if (status == Dispatcher.STOPSTATUS.ALIVE) {
				parent.getLogger().warn("Server="+parent.getName()+": Worker="+w.dsptch.getName()+" failed to stop");
			}
		}
	}

	private Worker launch(int idx) throws java.io.IOException
	{
		DispatcherConfig dcfg = new DispatcherConfig.Builder()
				.withName(parent.getDispatcher().getName()+"-worker"+(idx+1))
				.withLogger(parent.getLogger())
				.build();
		Dispatcher d = Dispatcher.create(dcfg);
		GateServer srvr = GateServer.createWorker(d, parent.getServerChannel(), parent.getConfig(), parent.getHandlerFactory());
		Thread thrd = d.start();
		return new Worker(d, srvr, thrd);
	}
}
