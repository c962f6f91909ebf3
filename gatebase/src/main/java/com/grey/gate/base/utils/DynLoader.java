/*
 * Copyright 2010-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.base.utils;

public class DynLoader
{
	// Class.forName(name) uses the loader of the calling class, which may produce unexpected results in managed
	// environments, so we use the thread context loader.
	public static Class<?> loadClass(String targetclass) throws ClassNotFoundException
	{
		ClassLoader cld = getClassLoader();
		return Class.forName(targetclass, true, cld);
	}

	public static java.net.URL getLoaderResource(String path, ClassLoader cld)
	{
		java.net.URL url = (cld == null ? null : cld.getResource(path));

		if (url == null) {
			ClassLoader cld_thrd = getClassLoader();
			if (cld_thrd != null && cld_thrd != cld) url = cld_thrd.getResource(path);
			if (url == null) {
				ClassLoader cld_sys = ClassLoader.getSystemClassLoader();
				if (cld_sys != null && cld_sys != cld_thrd) url = cld_sys.getResource(path);
			}
		}
		return url;
	}

	public static String readText(java.net.URL url) throws java.io.IOException
	{
		try (java.io.InputStream strm = url.openStream()) {
			byte[] buf = strm.readAllBytes();
			return new String(buf, java.nio.charset.StandardCharsets.UTF_8);
		}
	}

	/**
	 * Instantiates the given class via the first of the candidate constructors which it declares.
	 * Each element of ctorArgs is tried in turn, and an empty array denotes the no-arg constructor.
	 */
	public static <T> T createInstance(String clssnam, Class<T> target, Object[]... ctorArgs) throws ReflectiveOperationException
	{
		Class<?> clss = loadClass(clssnam);
		if (!target.isAssignableFrom(clss)) {
			throw new ClassCastException("Class="+clssnam+" is not of type "+target.getName());
		}
		for (Object[] args : ctorArgs) {
			Class<?>[] sig = new Class<?>[args.length];
			for (int idx = 0; idx != args.length; idx++) sig[idx] = args[idx].getClass();
			java.lang.reflect.Constructor<?> ctor;
			try {
				ctor = clss.getConstructor(sig);
			} catch (NoSuchMethodException ex) {
				continue;
			}
			return target.cast(ctor.newInstance(args));
		}
		throw new NoSuchMethodException("Class="+clssnam+" has no suitable constructor");
	}

	private static ClassLoader getClassLoader()
	{
		ClassLoader cld = Thread.currentThread().getContextClassLoader();
		if (cld == null) cld = DynLoader.class.getClassLoader();
		return cld;
	}
}
