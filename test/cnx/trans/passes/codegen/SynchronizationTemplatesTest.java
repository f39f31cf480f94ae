package cnx.trans.passes.codegen;

import cnx.InternalCompilerError;
import cnx.model.program.AssignmentOperator;
import cnx.model.program.CnxType;
import org.junit.Test;

import java.util.Arrays;
import java.util.EnumSet;

import static cnx.model.c.CBuilder.*;
import static cnx.model.program.CnxBuilder.atomic;
import static org.junit.Assert.*;

public class SynchronizationTemplatesTest {

	@Test
	public void selectiveMaskRaisingToCeiling() {
		SynchronizationTemplate template = SynchronizationTemplates.selectiveMask(3, 4, true);
		assertEquals(
				"uint32_t __cnx_basepri_3 = __cnx_get_BASEPRI();\n" +
						"__cnx_set_BASEPRI_MAX(CNX_PRIORITY_TO_BASEPRI(4));",
				template.getEnter());
		assertEquals("__cnx_set_BASEPRI(__cnx_basepri_3);", template.getExit());
		assertEquals(
				EnumSet.of(RuntimeHelper.GET_BASEPRI, RuntimeHelper.SET_BASEPRI_MAX, RuntimeHelper.SET_BASEPRI),
				template.getHelpers());
	}

	@Test
	public void selectiveMaskAlreadyHighEnough() {
		SynchronizationTemplate template = SynchronizationTemplates.selectiveMask(2, 2, false);
		assertEquals("uint32_t __cnx_basepri_2 = __cnx_get_BASEPRI();", template.getEnter());
		assertEquals("__cnx_set_BASEPRI(__cnx_basepri_2);", template.getExit());
		assertFalse(template.getHelpers().contains(RuntimeHelper.SET_BASEPRI_MAX));
	}

	@Test
	public void globalDisable() {
		SynchronizationTemplate template = SynchronizationTemplates.globalDisable(1);
		assertEquals("uint32_t __cnx_primask_1 = __cnx_get_PRIMASK();\n__cnx_disable_irq();", template.getEnter());
		assertEquals("__cnx_set_PRIMASK(__cnx_primask_1);", template.getExit());
	}

	@Test
	public void lockFreeRetryWord() {
		SynchronizationTemplate template = SynchronizationTemplates.lockFreeRetry(
				5, atomic("ticks", CnxType.U32), AssignmentOperator.ADD);
		assertEquals(
				"do {\n" +
						"    uint32_t __cnx_old_5 = __LDREXW(&ticks);\n" +
						"    uint32_t __cnx_new_5 = __cnx_old_5 + (",
				template.getEnter());
		assertEquals(
				");\n" +
						"    if (__STREXW(__cnx_new_5, &ticks) == 0) {\n" +
						"        break;\n" +
						"    }\n" +
						"} while (1);",
				template.getExit());
		assertTrue(template.getHelpers().isEmpty());
	}

	@Test
	public void lockFreeRetryNarrowTypes() {
		assertTrue(SynchronizationTemplates.lockFreeRetry(1, atomic("b", CnxType.I8), AssignmentOperator.OR)
				.getEnter().contains("int8_t __cnx_old_1 = __LDREXB(&b);"));
		assertTrue(SynchronizationTemplates.lockFreeRetry(1, atomic("h", CnxType.U16), AssignmentOperator.SHL)
				.getEnter().contains("__cnx_old_1 << ("));
		assertTrue(SynchronizationTemplates.lockFreeRetry(1, atomic("h", CnxType.U16), AssignmentOperator.SUB)
				.getExit().contains("__STREXH(__cnx_new_1, &h)"));
	}

	@Test(expected = InternalCompilerError.class)
	public void lockFreeRetryNeedsCompoundOperator() {
		SynchronizationTemplates.lockFreeRetry(1, atomic("ticks", CnxType.U32), AssignmentOperator.ASSIGN);
	}

	@Test(expected = InternalCompilerError.class)
	public void lockFreeRetryHasNoDoubleWordForm() {
		SynchronizationTemplates.lockFreeRetry(1, atomic("big", CnxType.U64), AssignmentOperator.ADD);
	}

	@Test
	public void debugGuardPrefix() {
		SynchronizationTemplate guarded = SynchronizationTemplates.debugGuard(
				SynchronizationTemplates.globalDisable(1), 3, "main#1");
		assertEquals(
				"if (__cnx_active_priority() > 3) {\n" +
						"    __cnx_ceiling_violation(\"main#1\");\n" +
						"}\n" +
						"uint32_t __cnx_primask_1 = __cnx_get_PRIMASK();\n" +
						"__cnx_disable_irq();",
				guarded.getEnter());
		assertEquals("__cnx_set_PRIMASK(__cnx_primask_1);", guarded.getExit());
		assertTrue(guarded.getHelpers().contains(RuntimeHelper.ACTIVE_PRIORITY));
		assertTrue(guarded.getHelpers().contains(RuntimeHelper.CEILING_VIOLATION));
	}

	@Test
	public void debugGuardBeforeRetryLoop() {
		SynchronizationTemplate guarded = SynchronizationTemplates.debugGuard(
				SynchronizationTemplates.lockFreeRetry(2, atomic("ticks", CnxType.U8), AssignmentOperator.ADD),
				1, "ticks@main:4:5");
		assertTrue(guarded.getEnter().startsWith("if (__cnx_active_priority() > 1) {\n"));
		assertTrue(guarded.getEnter().endsWith("__cnx_old_2 + ("));
		assertTrue(guarded.getExit().startsWith(");"));
	}

	@Test
	public void equalTemplates() {
		assertEquals(SynchronizationTemplates.globalDisable(4), SynchronizationTemplates.globalDisable(4));
		assertNotEquals(SynchronizationTemplates.globalDisable(4), SynchronizationTemplates.globalDisable(5));
	}

	@Test(expected = InternalCompilerError.class)
	public void templateWithoutHole() {
		new SynchronizationTemplate(Arrays.asList(callS("__cnx_disable_irq")), EnumSet.noneOf(RuntimeHelper.class));
	}

	@Test(expected = InternalCompilerError.class)
	public void templateWithTwoHoles() {
		new SynchronizationTemplate(Arrays.asList(statementHole(), statementHole()),
				EnumSet.noneOf(RuntimeHelper.class));
	}
}
