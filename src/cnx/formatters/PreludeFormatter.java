package cnx.formatters;

import cnx.trans.passes.codegen.EmissionPlan;
import cnx.trans.passes.codegen.RuntimeHelper;
import cnx.trans.passes.codegen.SynchronizationTemplates;

import java.io.IOException;
import java.util.Set;

/**
 * Writes the C definitions the fragments of a plan depend on, once per output.
 */
public class PreludeFormatter {

	private final IndentingWriter out;

	public PreludeFormatter(IndentingWriter out) {
		this.out = out;
	}

	public void format(EmissionPlan plan) throws IOException {
		out.write("/* critical section support for target ");
		out.write(plan.getCapabilities().getName());
		out.write(" */");
		out.newLine();
		out.write("#include <stdint.h>");
		out.newLine();
		if (!plan.emitsCode()) {
			return;
		}
		out.write("#include \"cmsis_gcc.h\"");
		out.newLine();

		Set<RuntimeHelper> helpers = plan.getHelpers();
		if (helpers.stream().anyMatch(RuntimeHelper::needsPriorityMapping)) {
			out.newLine();
			out.write("#ifndef CNX_MAX_PRIORITY");
			out.newLine();
			out.write("#define CNX_MAX_PRIORITY " + plan.getMaxInterruptPriority() + "U");
			out.newLine();
			out.write("#endif");
			out.newLine();
			out.write("/* context priority p runs at NVIC priority CNX_MAX_PRIORITY + 1 - p */");
			out.newLine();
			out.write("#ifndef " + SynchronizationTemplates.PRIORITY_TO_BASEPRI);
			out.newLine();
			out.write("#define " + SynchronizationTemplates.PRIORITY_TO_BASEPRI +
					"(p) ((uint32_t)((CNX_MAX_PRIORITY + 1U - (p)) << (8U - __NVIC_PRIO_BITS)))");
			out.newLine();
			out.write("#endif");
			out.newLine();
		}

		if (!helpers.isEmpty()) {
			out.newLine();
			for (RuntimeHelper helper : helpers) {
				out.write(helper.getDefinition());
				out.newLine();
			}
		}
	}
}
