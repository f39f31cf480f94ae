package cnx.trans.passes.codegen;

import cnx.InternalCompilerError;
import cnx.model.c.CExpression;
import cnx.model.program.AssignmentOperator;
import cnx.model.program.CnxResourceDeclaration;

import java.util.Arrays;
import java.util.EnumSet;

import static cnx.model.c.CBuilder.*;

/**
 * The C code of each synchronization strategy. N makes the saved-state variables of one
 * fragment distinct from every other fragment in the same output.
 */
public class SynchronizationTemplates {
	private SynchronizationTemplates() {}

	public static final String PRIORITY_TO_BASEPRI = "CNX_PRIORITY_TO_BASEPRI";

	/**
	 * Saves the masking threshold, raises it to the ceiling unless it is already at least that
	 * high, and restores exactly the saved value afterwards.
	 */
	public static SynchronizationTemplate selectiveMask(int n, int ceiling, boolean raise) {
		String saved = "__cnx_basepri_" + n;
		if (raise) {
			return new SynchronizationTemplate(Arrays.asList(
					declare("uint32_t", saved, call("__cnx_get_BASEPRI")),
					callS("__cnx_set_BASEPRI_MAX", call(PRIORITY_TO_BASEPRI, num(ceiling))),
					statementHole(),
					callS("__cnx_set_BASEPRI", var(saved))),
					EnumSet.of(RuntimeHelper.GET_BASEPRI, RuntimeHelper.SET_BASEPRI_MAX, RuntimeHelper.SET_BASEPRI));
		}
		return new SynchronizationTemplate(Arrays.asList(
				declare("uint32_t", saved, call("__cnx_get_BASEPRI")),
				statementHole(),
				callS("__cnx_set_BASEPRI", var(saved))),
				EnumSet.of(RuntimeHelper.GET_BASEPRI, RuntimeHelper.SET_BASEPRI));
	}

	public static SynchronizationTemplate globalDisable(int n) {
		String saved = "__cnx_primask_" + n;
		return new SynchronizationTemplate(Arrays.asList(
				declare("uint32_t", saved, call("__cnx_get_PRIMASK")),
				callS("__cnx_disable_irq"),
				statementHole(),
				callS("__cnx_set_PRIMASK", var(saved))),
				EnumSet.of(RuntimeHelper.GET_PRIMASK, RuntimeHelper.DISABLE_IRQ, RuntimeHelper.SET_PRIMASK));
	}

	/**
	 * An exclusive load/store loop applying a compound assignment; the hole is its right operand.
	 */
	public static SynchronizationTemplate lockFreeRetry(int n, CnxResourceDeclaration resource,
	                                                    AssignmentOperator operator) {
		if (!operator.isCompound()) {
			throw new InternalCompilerError("retry loop needs a compound assignment, got " + operator.getSymbol());
		}
		String suffix = exclusiveAccessSuffix(resource.getType().getWidth());
		String cType = resource.getType().getCName();
		String old = "__cnx_old_" + n;
		String updated = "__cnx_new_" + n;
		CExpression target = addressOf(var(resource.getName()));
		return new SynchronizationTemplate(Arrays.asList(
				doWhile(num(1),
						declare(cType, old, call("__LDREX" + suffix, target)),
						declare(cType, updated, binop(operator.getBinaryOperator(), var(old), parens(expressionHole()))),
						ifS(binop("==", call("__STREX" + suffix, var(updated), target), num(0)),
								breakS()))),
				EnumSet.noneOf(RuntimeHelper.class));
	}

	private static String exclusiveAccessSuffix(int width) {
		switch (width) {
			case 8:
				return "B";
			case 16:
				return "H";
			case 32:
				return "W";
			default:
				throw new InternalCompilerError("no exclusive access instructions for width " + width);
		}
	}

	public static SynchronizationTemplate debugGuard(SynchronizationTemplate template, int ceiling, String id) {
		return template.withPrefix(Arrays.asList(
				ifS(binop(">", call("__cnx_active_priority"), num(ceiling)),
						callS("__cnx_ceiling_violation", str(id)))),
				EnumSet.of(RuntimeHelper.ACTIVE_PRIORITY, RuntimeHelper.CEILING_VIOLATION, RuntimeHelper.DISABLE_IRQ));
	}
}
