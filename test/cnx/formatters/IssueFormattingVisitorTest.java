package cnx.formatters;

import cnx.errors.TopLevelIssueContext;
import cnx.model.context.ContextKind;
import cnx.model.context.ContextRegistry;
import cnx.model.context.DuplicateContextIssue;
import cnx.model.program.CnxProgram;
import cnx.trans.passes.reachability.MissingEntryFunctionIssue;
import cnx.trans.passes.reachability.ReachabilityPass;
import cnx.trans.passes.reachability.UnresolvedCallPolicy;
import cnx.util.SourceLocation;
import org.junit.Test;

import java.nio.file.Paths;
import java.util.Collections;

import static cnx.model.program.CnxBuilder.*;
import static org.junit.Assert.*;

public class IssueFormattingVisitorTest {

	@Test
	public void duplicateContext() {
		DuplicateContextIssue issue = new DuplicateContextIssue("USART1",
				new SourceLocation(Paths.get("board.cnx"), 12, 3),
				new SourceLocation(Paths.get("board.cnx"), 4, 3));
		assertEquals("execution context USART1 declared at 12:3 in file board.cnx " +
				"was already declared at 4:3 in file board.cnx", issue.getMessage());
	}

	@Test
	public void missingEntryFunction() {
		ContextRegistry.Builder builder = ContextRegistry.builder();
		builder.register("main", ContextKind.MAIN, "main");
		MissingEntryFunctionIssue issue = new MissingEntryFunctionIssue(
				builder.register(SourceLocation.unknown(), "dma", ContextKind.INTERRUPT, 1, "dma_done"));
		assertEquals("entry function dma_done of execution context dma is not defined in the program",
				issue.getMessage());
	}

	@Test
	public void issuesCarryTheirFunction() {
		CnxProgram program = program(
				Collections.singletonList(mainContext("main")),
				Collections.emptyList(),
				function("main", exprS(indirectCall(idexp("handler")))));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ContextRegistry.Builder builder = ContextRegistry.builder();
		builder.register("main", ContextKind.MAIN, "main");
		ReachabilityPass.perform(ctx, program, builder.build(), UnresolvedCallPolicy.REJECT);
		String text = ctx.format();
		assertTrue(text, text.startsWith("Detected 1 issue(s):\n"));
		assertTrue(text, text.contains(
				"while analyzing function main\n    indirect call at unknown source location cannot be resolved"));
		assertTrue(text, text.contains("assume_all_contexts"));
	}
}
