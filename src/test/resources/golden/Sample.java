package demo;

import java.util.List;
import java.util.ArrayList;
import java.util.function.Function;
import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;

/**
 * Every member kind the transpiler understands.
 */
public class Demo<T extends Comparable<T>> {
	private static final int LIMIT = 10;
	private List<T> items = new ArrayList<>();
	private Listener listener = new Listener() {
		@Override
		public void onEvent(String name) {
			System.out.println(name);
		}
	};

	static {
		System.out.println("loaded");
	}

	{
		items.clear();
	}

	public Demo(int capacity) throws IllegalArgumentException {
		if (capacity > LIMIT) {
			throw new IllegalArgumentException("too big");
		}
	}

	// generic method
	public <R> R apply(Function<T, R> f, T value) {
		return f.apply(value);
	}

	public int size() {
		return items.size();
	}

	abstract static class Node {
		abstract int weight();
	}

	interface Listener {
		void onEvent(String name);
	}

	static class Leaf extends Node {
		char[] label;

		int weight() {
			return 1;
		}
	}
}
