/*
 * Copyright 2010-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.reactor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import com.grey.gate.base.config.SysProps;
import com.grey.gate.errors.GateException;
import com.grey.gate.reactor.config.DispatcherConfig;
import com.grey.gate.logging.Logger;
import com.grey.gate.logging.Logger.LEVEL;

/**
 * Selector-based event loop.
 * <br>
 * A Dispatcher is single-threaded. Once a thread has entered {@link #loop(long, boolean)} only that thread may
 * register or modify channels, while {@link #stop()} and {@link #closeAll()} may be called from anywhere.
 */
public class Dispatcher
	implements EventLoop, Runnable
{
	public enum STOPSTATUS {STOPPED, ALIVE, FORCED}

	private static final long TMT_FORCEDSTOP = SysProps.getTime("greygate.dispatchers.forcestoptmt", "1s");
	private static final AtomicInteger anonDispatcherCount = new AtomicInteger();

	private final String dname;
	private final Logger logger;
	private final java.nio.channels.Selector slct;
	private final Map<Integer, ChannelMonitor> activeChannels = new LinkedHashMap<>(); //keyed on cm_id, in registration order
	private final AtomicInteger nextChannelId = new AtomicInteger(1);
	private final Thread threadMain;

	private volatile Thread loopThread; //the thread currently inside loop(), if any
	private volatile boolean stopRequested;
	private volatile boolean closeRequested;
	private volatile boolean closed;
	private boolean launched;

	//this is mainly for the benefit of test code - should be tested after Thread join
	private volatile boolean thread_completed;
	private volatile boolean error_abort;
	public boolean completedOK() {return thread_completed && !error_abort;}

	public String getName() {return dname;}
	public Logger getLogger() {return logger;}
	public boolean isLooping() {return loopThread != null;}
	public boolean isClosed() {return closed;}
	public boolean isStopRequested() {return stopRequested;}
	public boolean isRunning() {return threadMain.isAlive();}
	public boolean isDispatcherThread() {return Thread.currentThread() == loopThread;}
	public java.nio.channels.Selector getSelector() {return slct;}

	int allocateChannelId() {return nextChannelId.getAndIncrement();}

	@Override
	public synchronized int registeredChannelCount() {return activeChannels.size();}

	public static Dispatcher create(DispatcherConfig def) throws java.io.IOException {
		if (def == null) {
			def = new DispatcherConfig.Builder().build();
		}
		if (def.getName() == null || def.getName().isEmpty()) {
			String name = "AnonDispatcher-"+anonDispatcherCount.incrementAndGet();
			def = def.mutate().withName(name).build();
		}
		return new Dispatcher(def);
	}

	private Dispatcher(DispatcherConfig def) throws java.io.IOException {
		dname = def.getName();
		logger = def.getLogger();
		slct = java.nio.channels.Selector.open();
		threadMain = new Thread(this, "Dispatcher-"+dname);
		getLogger().info("Dispatcher="+dname+": Initialised with Selector="+slct.getClass().getCanonicalName()
				+", Provider="+slct.provider().getClass().getCanonicalName());
	}

	/**
	 * Runs the event loop on a dedicated thread, until all channels are closed or a stop is requested.
	 */
	public Thread start()
	{
		if (launched) throw new IllegalStateException("Dispatcher="+getName()+" has already been started");
		launched = true;
		threadMain.start();
		return threadMain;
	}

	@Override
	public void run()
	{
		getLogger().info("Dispatcher="+getName()+": Started thread="+Thread.currentThread().getName()+":T"+Thread.currentThread().getId());
		boolean ok = true;
		try {
			loop(-1, true);
		} catch (Throwable ex) {
			if (com.grey.gate.base.ExceptionUtils.isInterrupt(ex)) {
				getLogger().info("Dispatcher="+getName()+": Thread has been interrupted - "+ex.getClass().getName());
			} else {
				getLogger().log(LEVEL.ERR, ex, true, "Dispatcher="+getName()+" has terminated abnormally");
				error_abort = true;
				ok = false;
			}
		}
		closeAll();
		try {
			getLogger().flush();
		} catch (Exception ex) {
			getLogger().trace("Dispatcher="+getName()+": Final thread flush failed - "+ex);
		}
		getLogger().info("Dispatcher="+getName()+" thread has terminated with abort="+error_abort);
		thread_completed = ok;
	}

	// This method can be called by other threads
	public void stop()
	{
		if (stopRequested) return;
		getLogger().info("Dispatcher="+getName()+": Received Stop request - looping="+isLooping()+", Channels="+registeredChannelCount());
		stopRequested = true;
		slct.wakeup();
	}

	// meant to be called by other threads
	public STOPSTATUS waitStopped(long timeout, boolean force)
	{
		if (timeout < 0) timeout = 1L;
		boolean done = false;
		do {
			try {
				threadMain.join(timeout);
				done = true;
			} catch (InterruptedException ex) {
				getLogger().trace("Dispatcher="+getName()+": Interrupted while waiting for thread to stop");
			}
		} while (!done);
		if (!threadMain.isAlive()) return STOPSTATUS.STOPPED;
		if (!force) return STOPSTATUS.ALIVE;
		getLogger().warn("Dispatcher="+getName()+": Forced stop after timeout="+timeout);
		threadMain.interrupt(); //maximise the chances of waking up a blocked thread
		stop();
		if (waitStopped(TMT_FORCEDSTOP, false) == STOPSTATUS.STOPPED) return STOPSTATUS.FORCED;
		return STOPSTATUS.ALIVE; //failed to stop it - could only happen if blocked in an application callback
	}

	// This is the Dispatcher's main loop.
	@Override
	public void loop(long timeout, boolean blocking) throws InterruptedException, java.io.IOException
	{
		Thread thrd = Thread.currentThread();
		synchronized (this) {
			if (loopThread != null && loopThread != thrd) {
				throw new IllegalStateException("Dispatcher="+getName()+": Loop already active on thread="+loopThread.getName());
			}
			loopThread = thrd;
		}
		try {
			do {
				if (Thread.interrupted()) {
					throw new InterruptedException("Dispatcher="+getName()+" interrupted");
				}
				if (stopRequested || closed) break;
				int nkeys;
				if (timeout < 0) {
					nkeys = slct.select();
				} else if (timeout == 0) {
					nkeys = slct.selectNow();
				} else {
					nkeys = slct.select(timeout);
				}
				if (nkeys != 0) fireIO();
				if (closeRequested) {
					closeAll();
					break;
				}
			} while (blocking && !stopRequested && registeredChannelCount() != 0);
		} finally {
			loopThread = null;
		}
	}

	private void fireIO()
	{
		// take a copy, as closing channels during the callouts would otherwise upset the iteration
		Set<java.nio.channels.SelectionKey> keys = slct.selectedKeys();
		java.nio.channels.SelectionKey[] arr = keys.toArray(new java.nio.channels.SelectionKey[0]);
		keys.clear(); //this clears the NIO Ready set - NIO would hang otherwise

		for (int idx = 0; idx != arr.length; idx++) {
			// By testing if SelectionKey is still valid, we guard against delivering events to a monitor that was
			// disabled by an earlier event in the current callout cycle.
			java.nio.channels.SelectionKey key = arr[idx];
			if (!key.isValid()) continue;
			ChannelMonitor cm = (ChannelMonitor)key.attachment();
			try {
				cm.handleIO(key.readyOps());
			} catch (Throwable ex) {
				eventHandlerFailed(cm, ex);
			}
		}
	}

	private void eventHandlerFailed(ChannelMonitor cm, Throwable ex)
	{
		LEVEL lvl = (GateException.isError(ex) ? LEVEL.ERR : LEVEL.TRC2);
		if (getLogger().isActive(lvl)) {
			getLogger().log(lvl, ex, lvl==LEVEL.ERR, "Dispatcher="+getName()+": Error on I/O handler="+cm);
		}
		try {
			cm.eventError(ex);
		} catch (Throwable ex2) {
			getLogger().log(LEVEL.ERR, ex2, true, "Dispatcher="+getName()+": Error Handler failed - "+cm
					+" - "+com.grey.gate.base.ExceptionUtils.summary(ex));
		}
	}

	/**
	 * Disconnects every registered channel and releases the selector.
	 * If another thread is currently inside the loop, the close is carried out by that thread once it wakes up.
	 */
	@Override
	public void closeAll()
	{
		Thread thrd = loopThread;
		if (thrd != null && thrd != Thread.currentThread()) {
			closeRequested = true;
			slct.wakeup();
			return;
		}
		if (closed) return;
		List<ChannelMonitor> lst;
		synchronized (this) {
			lst = new ArrayList<>(activeChannels.values()); // take copy of list to prevent concurrent modification
		}
		getLogger().info("Dispatcher="+getName()+": Closing all channels="+lst.size());

		for (ChannelMonitor cm : lst) {
			if (!isRegistered(cm)) continue; //must have been removed as side-effect of another close
			cm.disconnect();
		}
		closed = true;
		try {
			if (slct.isOpen()) slct.close();
		} catch (Throwable ex) {
			getLogger().log(LEVEL.INFO, ex, false, "Dispatcher="+getName()+": Failed to close NIO Selector");
		}
		getLogger().info("Dispatcher="+getName()+": Closed all channels - remaining="+registeredChannelCount());
	}

	// ChannelMonitors must bookend all their activity between a single call to this method and another one
	// to deregisterIO().
	// In between, they can call monitorIO() multiple times to stop and start listening for specific I/O events.
	void registerIO(ChannelMonitor cm) {
		verifyIsLoopThread();
		if (closed) {
			throw new IllegalStateException("Dispatcher="+getName()+": Illegal registerIO after close on CM="+cm);
		}
		synchronized (this) {
			if (activeChannels.put(cm.getCMID(), cm) != null) {
				throw new IllegalStateException("Dispatcher="+getName()+": Illegal registerIO on CM="+cm.getClass().getName()+"/E"+cm.getCMID()+" - "+cm);
			}
		}
	}

	// Returns false if the channel was not registered, which is harmless
	boolean deregisterIO(ChannelMonitor cm) {
		verifyIsLoopThread();
		boolean removed;
		synchronized (this) {
			removed = (activeChannels.remove(cm.getCMID()) != null);
		}
		if (cm.getRegistrationKey() != null) {
			cm.getRegistrationKey().cancel();
			cm.setRegistrationKey(null);
		}
		return removed;
	}

	synchronized boolean isRegistered(ChannelMonitor cm) {
		return activeChannels.get(cm.getCMID()) == cm;
	}

	void monitorIO(ChannelMonitor cm, int ops) throws java.nio.channels.ClosedChannelException {
		verifyIsLoopThread();
		if (closed) return;
		if (cm.getRegistrationKey() == null) {
			//3rd arg has same effect as calling attach(handler) on returned SelectionKey
			cm.setRegistrationKey(cm.getChannel().register(slct, ops, cm));
		} else {
			cm.getRegistrationKey().interestOps(ops);
		}
	}

	private void verifyIsLoopThread() {
		Thread thrd = loopThread;
		if (thrd == null || thrd == Thread.currentThread()) return;
		throw new IllegalStateException("Dispatcher="+getName()+": Called by foreign thread="+Thread.currentThread().getName()
				+" while loop runs on "+thrd.getName());
	}

	@Override
	public String toString() {
		return super.toString()+" with name="+getName();
	}
}
