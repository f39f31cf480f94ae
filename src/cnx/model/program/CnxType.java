package cnx.model.program;

import java.util.Optional;

/**
 * The primitive types a shared resource may have, with their C spelling and width in bits.
 */
public enum CnxType {
	U8("u8", "uint8_t", 8, true),
	U16("u16", "uint16_t", 16, true),
	U32("u32", "uint32_t", 32, true),
	U64("u64", "uint64_t", 64, true),
	I8("i8", "int8_t", 8, true),
	I16("i16", "int16_t", 16, true),
	I32("i32", "int32_t", 32, true),
	I64("i64", "int64_t", 64, true),
	BOOL("bool", "bool", 8, false),
	F32("f32", "float", 32, false),
	F64("f64", "double", 64, false);

	private final String name;
	private final String cName;
	private final int width;
	private final boolean integer;

	CnxType(String name, String cName, int width, boolean integer) {
		this.name = name;
		this.cName = cName;
		this.width = width;
		this.integer = integer;
	}

	public String getName() {
		return name;
	}

	public String getCName() {
		return cName;
	}

	public int getWidth() {
		return width;
	}

	public boolean isInteger() {
		return integer;
	}

	public static Optional<CnxType> fromName(String name) {
		for (CnxType type : values()) {
			if (type.name.equals(name)) {
				return Optional.of(type);
			}
		}
		return Optional.empty();
	}
}
