package cnx.trans.passes.codegen;

import cnx.model.program.CnxType;

import java.util.*;

/**
 * What the target processor offers for synchronization.
 */
public final class TargetCapabilities {
	public static final TargetCapabilities DEFAULT = new TargetCapabilities("default", 32, false, null);

	private static final Map<String, TargetCapabilities> NAMED = new LinkedHashMap<>();

	static {
		for (String armv7m : Arrays.asList("teensy41", "teensy40", "cortex-m7", "cortex-m4", "cortex-m3")) {
			NAMED.put(armv7m, new TargetCapabilities(armv7m, 32, true, 32));
		}
		NAMED.put("cortex-m0+", new TargetCapabilities("cortex-m0+", 32, false, 32));
		NAMED.put("cortex-m0", new TargetCapabilities("cortex-m0", 32, false, null));
		NAMED.put("avr", new TargetCapabilities("avr", 8, false, null));
	}

	private final String name;
	private final int wordSize;
	private final boolean supportsSelectiveMasking;
	private final Integer lockFreeRetryMaxWidth;

	/**
	 * @param lockFreeRetryMaxWidth widest operand, in bits, that exclusive load/store can update;
	 *                              null if the target has no exclusive access instructions
	 */
	public TargetCapabilities(String name, int wordSize, boolean supportsSelectiveMasking,
	                          Integer lockFreeRetryMaxWidth) {
		this.name = name;
		this.wordSize = wordSize;
		this.supportsSelectiveMasking = supportsSelectiveMasking;
		this.lockFreeRetryMaxWidth = lockFreeRetryMaxWidth;
	}

	public static Optional<TargetCapabilities> named(String name) {
		return Optional.ofNullable(NAMED.get(name));
	}

	public static Set<String> getNames() {
		return Collections.unmodifiableSet(NAMED.keySet());
	}

	public String getName() {
		return name;
	}

	public int getWordSize() {
		return wordSize;
	}

	public boolean supportsSelectiveMasking() {
		return supportsSelectiveMasking;
	}

	public Optional<Integer> getLockFreeRetryMaxWidth() {
		return Optional.ofNullable(lockFreeRetryMaxWidth);
	}

	/**
	 * Exclusive load/store intrinsics exist for 8, 16 and 32 bit integers only.
	 */
	public boolean supportsLockFreeRetry(CnxType type) {
		return lockFreeRetryMaxWidth != null &&
				type.isInteger() &&
				type.getWidth() <= 32 &&
				type.getWidth() <= lockFreeRetryMaxWidth;
	}

	/**
	 * @return true if a plain load or store of the type is one instruction
	 */
	public boolean isSingleAccess(CnxType type) {
		return type.getWidth() <= wordSize;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TargetCapabilities that = (TargetCapabilities) o;
		return wordSize == that.wordSize &&
				supportsSelectiveMasking == that.supportsSelectiveMasking &&
				Objects.equals(name, that.name) &&
				Objects.equals(lockFreeRetryMaxWidth, that.lockFreeRetryMaxWidth);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, wordSize, supportsSelectiveMasking, lockFreeRetryMaxWidth);
	}

	@Override
	public String toString() {
		return name;
	}
}
