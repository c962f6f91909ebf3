/*
 * Copyright 2010-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.server;

import com.grey.gate.base.config.SysProps;
import com.grey.gate.base.utils.TimeOps;
import com.grey.gate.errors.GateBindException;
import com.grey.gate.errors.GateConfigException;
import com.grey.gate.reactor.ChannelMonitor;
import com.grey.gate.reactor.Dispatcher;
import com.grey.gate.reactor.config.SSLConfig;
import com.grey.gate.server.config.ServerConfig;
import com.grey.gate.logging.Logger.LEVEL;
import com.grey.gate.logging.Parameters;

/**
 * Listens on a server socket, applies admission control to each incoming connection and hands the survivors
 * to a protocol handler.
 * <br>
 * The server is bound by its create() method, and is then run by serve(), either inline on the Dispatcher it was
 * created with or across a pool of worker Dispatchers which share its listening socket. Once closed it cannot be
 * restarted.
 */
public class GateServer
	extends ChannelMonitor
	implements AutoCloseable
{
	public enum STATE {CREATED, BOUND, SERVING, STOPPING, CLOSED}

	private static final long TMT_HOOKJOIN = SysProps.getTime("greygate.server.exitwait", "5s");

	private final String name;
	private final ServerConfig config;
	private final HandlerFactory factory;
	private final AdmissionControl admission;
	private final java.nio.channels.ServerSocketChannel srvchan;
	private final java.net.InetSocketAddress srvaddr;
	private final boolean isWorker;

	private volatile STATE state = STATE.CREATED;
	private volatile Thread serveThread;
	private volatile WorkerPool workers;
	private volatile boolean shutdownRequested;

	public String getName() {return name;}
	public ServerConfig getConfig() {return config;}
	public SSLConfig getSSLConfig() {return config.getConfigSSL();}
	public HandlerFactory getHandlerFactory() {return factory;}
	public AdmissionControl getAdmissionControl() {return admission;}
	public STATE getState() {return state;}
	public java.net.InetSocketAddress getAddress() {return srvaddr;}
	public boolean isServing() {return state == STATE.SERVING;}

	java.nio.channels.ServerSocketChannel getServerChannel() {return srvchan;}
	WorkerPool getWorkerPool() {return workers;}

	/**
	 * Binds to the configured interface and port.
	 */
	public static GateServer create(Dispatcher d, ServerConfig cfg, HandlerFactory fact) throws GateBindException {
		return new GateServer(d, null, true, false, cfg, fact);
	}

	/**
	 * Adopts a listening socket which the caller has already bound. The server takes ownership of it.
	 */
	public static GateServer create(Dispatcher d, java.nio.channels.ServerSocketChannel chan, ServerConfig cfg, HandlerFactory fact) throws GateBindException {
		return new GateServer(d, chan, true, false, cfg, fact);
	}

	// shares the parent's listening socket, without taking ownership
	static GateServer createWorker(Dispatcher d, java.nio.channels.ServerSocketChannel chan, ServerConfig cfg, HandlerFactory fact) throws GateBindException {
		return new GateServer(d, chan, false, true, cfg, fact);
	}

	private GateServer(Dispatcher d, java.nio.channels.ServerSocketChannel chan, boolean owner, boolean worker,
			ServerConfig cfg, HandlerFactory fact) throws GateBindException {
		super(d);
		config = cfg;
		factory = fact;
		isWorker = worker;
		name = (worker ? cfg.getName()+"/"+d.getName() : cfg.getName());
		admission = new AdmissionControl(cfg.getMaxConns(), cfg.getMaxConnsPerIP());

		getLogger().info("Server="+name+" in Dispatcher="+d.getName()+" initialising on interface="+cfg.getInterface()
				+", port="+cfg.getPort()+" with factory="+fact+" - ssl="+cfg.getConfigSSL());

		if (chan == null) {
			srvchan = bind(cfg.getInterface(), cfg.getPort(), cfg.getBacklog());
		} else {
			srvchan = chan;
		}
		srvaddr = getBoundAddress(srvchan);

		try {
			registerChannel(srvchan, owner);
			enableListen();
		} catch (Exception ex) {
			if (owner) closeChannel(srvchan);
			throw new GateBindException("Server="+name+": Failed to listen on "+srvaddr, srvaddr, ex);
		}
		state = STATE.BOUND;
		getLogger().info("Server="+name+" bound to "+srvaddr.getAddress()+":"+srvaddr.getPort()+(cfg.getPort()==0 && chan == null?"/dynamic":"")
				+(chan==null ? " with backlog="+cfg.getBacklog() : (owner ? " on adopted socket" : " on shared socket"))
				+" - "+admission);
	}

	private java.nio.channels.ServerSocketChannel bind(String iface, int port, int backlog) throws GateBindException {
		java.net.InetSocketAddress addr = (iface == null ? new java.net.InetSocketAddress(port) : new java.net.InetSocketAddress(iface, port));
		if (addr.isUnresolved()) {
			throw new GateBindException("Server="+name+": Cannot resolve interface="+iface, addr);
		}
		java.nio.channels.ServerSocketChannel chan = null;
		try {
			chan = java.nio.channels.ServerSocketChannel.open();
			chan.setOption(java.net.StandardSocketOptions.SO_REUSEADDR, Boolean.TRUE);
			chan.bind(addr, backlog);
			return chan;
		} catch (Exception ex) {
			if (chan != null) closeChannel(chan);
			throw new GateBindException("Server="+name+": Failed to bind to "+addr+" - "+ex.getMessage(), addr, ex);
		}
	}

	private java.net.InetSocketAddress getBoundAddress(java.nio.channels.ServerSocketChannel chan) throws GateBindException {
		java.net.SocketAddress addr;
		try {
			addr = chan.getLocalAddress();
		} catch (java.io.IOException ex) {
			throw new GateBindException("Server="+name+": Adopted socket is unusable - "+chan, null, ex);
		}
		if (addr == null) {
			throw new GateBindException("Server="+name+": Adopted socket is not bound - "+chan, null);
		}
		return (java.net.InetSocketAddress)addr;
	}

	/**
	 * Runs the server until it is shut down, or for a single pass of the event loop if blocking is false.
	 * @param timeout Maximum milliseconds for one wait on the event loop, where negative means indefinite
	 * @param blocking False means return after one pass of the event loop
	 * @param handleInterrupt If true, an interrupt ends the serve quietly. If false, InterruptedException is thrown.
	 * @param workerCount 1 to serve inline on the calling thread, else the number of workers (zero or less means one per processor)
	 */
	public void serve(long timeout, boolean blocking, boolean handleInterrupt, int workerCount) throws InterruptedException, java.io.IOException
	{
		boolean prefork = (workerCount != 1);
		if (prefork && !blocking) {
			throw new GateConfigException("Server="+name+": Workers="+workerCount+" cannot be combined with non-blocking serve");
		}
		if (state == STATE.STOPPING || state == STATE.CLOSED) {
			throw new IllegalStateException("Server="+name+" cannot serve in state="+state);
		}
		int nworkers = (workerCount <= 0 ? Runtime.getRuntime().availableProcessors() : workerCount);
		boolean logdiags = (handleInterrupt && blocking);

		if (state != STATE.SERVING) {
			if (logdiags) logStart(prefork, nworkers, timeout);
			getLogger().info(">>> starting "+name+(getSSLConfig()==null?"":"+SSL")+" server on "+srvaddr.getHostString()+":"+srvaddr.getPort()
					+", pid="+Parameters.CURRENT_PID+" <<<");
			state = STATE.SERVING;
		}
		Thread hook = null;
		serveThread = Thread.currentThread();
		try {
			if (logdiags) hook = installShutdownHook();
			if (shutdownRequested) {
				getLogger().info("Server="+name+": Shutdown was requested before serving");
			} else if (prefork) {
				serveWorkers(nworkers);
			} else {
				getDispatcher().loop(timeout, blocking);
			}
		} catch (InterruptedException ex) {
			if (!handleInterrupt) {
				stopWorkers();
				throw ex;
			}
			getLogger().info("Server="+name+": received interrupt signal");
		} finally {
			serveThread = null;
			if (hook != null) removeShutdownHook(hook);
		}

		if (blocking || shutdownRequested) {
			if (logdiags) {
				getLogger().info(">>> shutting down server, "+getDispatcher().registeredChannelCount()+" socket(s), pid="+Parameters.CURRENT_PID+" <<<");
			}
			closeAll();
		}
	}

	private void serveWorkers(int nworkers) throws InterruptedException, java.io.IOException
	{
		WorkerPool pool = new WorkerPool(this, nworkers);
		workers = pool;
		pool.start();
		if (shutdownRequested) pool.stop(); //shutdown() may have missed the pool
		pool.awaitTermination();
	}

	private void stopWorkers()
	{
		WorkerPool pool = workers;
		workers = null;
		if (pool == null) return;
		pool.stop();
		pool.waitStopped();
	}

	/**
	 * Asks the server to stop. This may be called from any thread.
	 * If another thread is serving, it is woken up and performs the close itself, else the server is closed immediately.
	 */
	public void shutdown()
	{
		shutdownRequested = true;
		Thread thrd = serveThread;
		if (thrd != null && thrd != Thread.currentThread()) {
			getLogger().info("Server="+name+": Received shutdown request from thread="+Thread.currentThread().getName()+" - serving="+thrd.getName());
			WorkerPool pool = workers;
			if (pool != null) pool.stop();
			getDispatcher().stop();
			return;
		}
		closeAll();
	}

	/**
	 * Closes the listening socket and every connection in the registry. This is irreversible, and repeated calls have no effect.
	 */
	public void closeAll()
	{
		if (state == STATE.CLOSED) return;
		Thread thrd = serveThread;
		if (thrd != null && thrd != Thread.currentThread()) {
			//the serving thread owns the Dispatcher, so get it to do the close
			shutdown();
			return;
		}
		if (getDispatcher().isLooping() && !getDispatcher().isDispatcherThread()) {
			//somebody other than serve() is running our Dispatcher, so it will have to do the close
			getDispatcher().closeAll();
			return;
		}
		getLogger().info("Server="+name+": Closing with state="+state+", connections="+getRegistrySize()+" - "+admission);
		state = STATE.STOPPING;
		stopWorkers();
		getDispatcher().closeAll();
		disconnect(); //in case the Dispatcher was already closed without us
		state = STATE.CLOSED;
		getLogger().info("Server="+name+": Closed - remaining connections="+getRegistrySize());
	}

	@Override
	public void close()
	{
		closeAll();
	}

	/**
	 * Number of connections in the registry of our Dispatcher, excluding our own listening socket.
	 */
	public int getRegistrySize()
	{
		int cnt = getDispatcher().registeredChannelCount();
		if (!isDisconnected() && getChannel() != null) cnt--;
		return cnt;
	}

	// We know that the readyOps argument must indicate an Accept (that's all we registered for), so don't bother checking it.
	@Override
	protected void ioIndication(int readyOps) throws java.io.IOException
	{
		while (!isDisconnected()) {
			java.nio.channels.SocketChannel connsock;
			try {
				connsock = srvchan.accept();
			} catch (java.io.IOException ex) {
				// aborted connection or descriptor exhaustion - not fatal to the listener
				getLogger().log(LEVEL.WARN, ex, false, "Server="+name+": accept() failed");
				return;
			}
			if (connsock == null) return;
			java.net.InetSocketAddress remote = null;
			try {
				remote = (java.net.InetSocketAddress)connsock.getRemoteAddress();
			} catch (java.io.IOException ex) {
				if (getLogger().isActive(ConnectionHandler.LOGLEVEL_CNX)) {
					getLogger().log(ConnectionHandler.LOGLEVEL_CNX, "Server="+name+": Cannot get remote address of "+connsock+" - "+ex);
				}
			}
			handleAccepted(connsock, remote);
		}
	}

	/**
	 * Dispatches a newly accepted connection. This never throws.
	 */
	public void handleAccepted(java.nio.channels.SocketChannel connsock, java.net.InetSocketAddress remote)
	{
		ConnectionHandler handler = null;
		String ip = null;
		try {
			handler = factory.createHandler(connsock, this, getDispatcher());
			if (!handler.isConnected()) return;
			handler.attach();

			java.net.InetSocketAddress addr = (remote == null ? handler.getRemoteAddress() : remote);
			ip = addr.getAddress().getHostAddress();
			admission.addAddress(ip);
			handler.setRecordedAddress(ip);

			if (!admission.shouldAcceptMore(getRegistrySize())) {
				if (getLogger().isActive(LEVEL.TRC)) getLogger().trace("Server="+name+": Rejecting "+addr+" - too many connections="+getRegistrySize());
				reject(handler, false);
				return;
			}
			if (admission.perAddressExceeded(ip)) {
				if (getLogger().isActive(LEVEL.TRC)) getLogger().trace("Server="+name+": Rejecting "+addr+" - too many connections from IP="+admission.getCount(ip));
				reject(handler, true);
				return;
			}
			try {
				handler.handle();
			} catch (Exception ex) {
				handler.handleError(ex);
			}
		} catch (Throwable ex) {
			getLogger().log(LEVEL.ERR, ex, true, "Server="+name+": Failed to dispatch connection="+connsock+" with handler="+handler);
			if (handler != null) handler.close();
			closeChannel(connsock); //a no-op if the handler owned and closed it
		}
	}

	// A peer that resets while we are sending the refusal is not a server error
	private void reject(ConnectionHandler handler, boolean perIP)
	{
		try {
			if (perIP) {
				handler.handleMaxConsPerIp();
			} else {
				handler.handleMaxCons();
			}
		} catch (java.io.IOException ex) {
			if (getLogger().isActive(ConnectionHandler.LOGLEVEL_CNX)) {
				getLogger().log(ConnectionHandler.LOGLEVEL_CNX, "Server="+name+": Failed to send refusal to "+handler.getRemoteAddress()+" - "+ex);
			}
			handler.close();
		}
	}

	void releaseAddress(String ip)
	{
		if (!admission.removeAddress(ip)) {
			getLogger().warn("Server="+name+": Released unknown address="+ip+" - "+admission);
		}
	}

	@Override
	protected void eventError(Throwable ex)
	{
		getLogger().error("Server="+name+": Closing listener after error - "+com.grey.gate.base.ExceptionUtils.summary(ex));
		disconnect();
	}

	@Override
	protected void channelClosed()
	{
		getLogger().info("Server="+name+": Listener on "+srvaddr+" has been closed");
	}

	private void logStart(boolean prefork, int nworkers, long timeout)
	{
		String model = (prefork ? "prefork + async (workers="+nworkers+")" : "async");
		getLogger().info("Server="+name+": concurrency model: "+model);
		if (getLogger().isActive(LEVEL.TRC)) {
			getLogger().trace("Server="+name+": poller: "+getDispatcher().getSelector().getClass().getName());
			getLogger().trace("Server="+name+": handler factory: "+factory.getClass().getName());
			getLogger().trace("Server="+name+": max connections: "+(admission.getMaxConns()==0 ? "unlimited" : admission.getMaxConns()));
			getLogger().trace("Server="+name+": max connections per ip: "+(admission.getMaxConnsPerIP()==0 ? "unlimited" : admission.getMaxConnsPerIP()));
			getLogger().trace("Server="+name+": loop timeout: "+(timeout < 0 ? "unlimited" : TimeOps.expandMilliTime(timeout)));
			getLogger().trace("Server="+name+": SSL: "+(getSSLConfig()==null ? "disabled" : getSSLConfig().getProtocol()));
		}
	}

	// Lets a JVM termination signal interrupt the serving thread, so that it shuts down the same way it does on any other interrupt
	private Thread installShutdownHook()
	{
		Thread target = Thread.currentThread();
		Thread hook = new Thread(() -> {
			getLogger().info("Server="+name+": JVM is terminating - interrupting thread="+target.getName());
			target.interrupt();
			try {
				target.join(TMT_HOOKJOIN);
			} catch (InterruptedException ex) {
				getLogger().info("Server="+name+": Interrupted while waiting for server to stop");
			}
		}, "ShutdownHook-"+name);
		Runtime.getRuntime().addShutdownHook(hook);
		return hook;
	}

	private void removeShutdownHook(Thread hook)
	{
		try {
			Runtime.getRuntime().removeShutdownHook(hook);
		} catch (IllegalStateException ex) {
			getLogger().trace("Server="+name+": Shutdown hook remains active, JVM is terminating");
		}
	}

	private void closeChannel(java.nio.channels.Channel chan)
	{
		try {
			chan.close();
		} catch (Exception ex) {
			getLogger().log(LEVEL.TRC, ex, false, "Server="+name+": Failed to close "+chan);
		}
	}

	@Override
	public String toString() {
		return super.toString()+" - Server="+name+"/"+state+(isWorker ? "/worker" : "");
	}
}
