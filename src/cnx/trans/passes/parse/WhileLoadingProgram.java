package cnx.trans.passes.parse;

import cnx.errors.Context;
import cnx.errors.ContextVisitor;

import java.nio.file.Path;

public class WhileLoadingProgram extends Context {

	private final Path exportPath;

	public WhileLoadingProgram(Path exportPath) {
		this.exportPath = exportPath;
	}

	public Path getExportPath() {
		return exportPath;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
