/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.server;

import java.util.HashMap;
import java.util.Map;

/**
 * Connection limits, and the count of connections per remote address.
 * <br>
 * The global limit admits a connection while the registry size is at most maxConns, whereas the per-address limit
 * only rejects once the count exceeds maxConnsPerIP. Both checks are applied after the new connection has been
 * counted, and a limit of zero disables the respective check.
 * <br>
 * Not thread-safe. Each instance belongs to the Dispatcher thread of its server.
 */
public class AdmissionControl
{
	private final int maxConns;
	private final int maxConnsPerIP;
	private final Map<String, Integer> addressCounts = new HashMap<>();
	private int total;

	public AdmissionControl(int maxConns, int maxConnsPerIP)
	{
		this.maxConns = maxConns;
		this.maxConnsPerIP = maxConnsPerIP;
	}

	public int getMaxConns() {return maxConns;}
	public int getMaxConnsPerIP() {return maxConnsPerIP;}

	public boolean shouldAcceptMore(int registrySize)
	{
		return (maxConns == 0 || registrySize <= maxConns);
	}

	public boolean perAddressExceeded(String ip)
	{
		return (maxConnsPerIP > 0 && getCount(ip) > maxConnsPerIP);
	}

	public void addAddress(String ip)
	{
		addressCounts.merge(ip, 1, Integer::sum);
		total++;
	}

	// Returns false if the address was not recorded
	public boolean removeAddress(String ip)
	{
		Integer cnt = addressCounts.get(ip);
		if (cnt == null) return false;
		if (cnt == 1) {
			addressCounts.remove(ip);
		} else {
			addressCounts.put(ip, cnt - 1);
		}
		total--;
		return true;
	}

	public int getCount(String ip)
	{
		Integer cnt = addressCounts.get(ip);
		return (cnt == null ? 0 : cnt);
	}

	/**
	 * Total number of recorded connections, across all addresses.
	 */
	public int size() {return total;}

	@Override
	public String toString() {
		return "AdmissionControl[maxconns="+maxConns+", maxconns_per_ip="+maxConnsPerIP+", active="+total+"/"+addressCounts.size()+"]";
	}
}
