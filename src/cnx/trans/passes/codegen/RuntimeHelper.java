package cnx.trans.passes.codegen;

/**
 * Definitions the emitted fragments call into. The wrappers keep generated code clear of
 * platform headers that define the CMSIS names as macros.
 */
public enum RuntimeHelper {
	DISABLE_IRQ("static inline void __cnx_disable_irq(void) { __disable_irq(); }"),
	GET_PRIMASK("static inline uint32_t __cnx_get_PRIMASK(void) { return __get_PRIMASK(); }"),
	SET_PRIMASK("static inline void __cnx_set_PRIMASK(uint32_t mask) { __set_PRIMASK(mask); }"),
	GET_BASEPRI("static inline uint32_t __cnx_get_BASEPRI(void) { return __get_BASEPRI(); }"),
	SET_BASEPRI("static inline void __cnx_set_BASEPRI(uint32_t threshold) { __set_BASEPRI(threshold); }"),
	SET_BASEPRI_MAX("static inline void __cnx_set_BASEPRI_MAX(uint32_t threshold) { __set_BASEPRI_MAX(threshold); }"),
	ACTIVE_PRIORITY("uint32_t __cnx_active_priority(void);"),
	CEILING_VIOLATION("__attribute__((weak)) void __cnx_ceiling_violation(const char *region) {\n" +
			"    (void)region;\n" +
			"    __cnx_disable_irq();\n" +
			"    for (;;) {\n" +
			"    }\n" +
			"}");

	private final String definition;

	RuntimeHelper(String definition) {
		this.definition = definition;
	}

	public String getDefinition() {
		return definition;
	}

	public boolean needsPriorityMapping() {
		return this == SET_BASEPRI_MAX;
	}
}
