package dev.trellis.launcher;

import com.beust.jcommander.*;
import com.beust.jcommander.converters.IParameterSplitter;
import dev.trellis.testrunner.RunConfig;
import dev.trellis.testrunner.filter.TagExpression;
import dev.trellis.testrunner.filter.TagExpressionException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

class TestRunnerArgs {
	public static final Path DEFAULT_CACHE_DIR = Path.of(".trellis_cache");

	@Parameter(names = { "-h", "--help" }, help = true)
	public boolean help = false;

	@Parameter(description = "Manifest files or directories", required = true)
	public List<Path> paths;

	@Parameter(names = { "-n", "--num-workers" }, description = "Number of workers, 0 for one per processor", validateValueWith = NonNegativeValueValidator.class)
	public int numWorkers = 0;

	@Parameter(names = { "--no-parallel" }, description = "Run everything on a single worker")
	public boolean noParallel = false;

	@Parameter(names = { "--no-cache" }, description = "Ignore recorded test durations when planning")
	public boolean noCache = false;

	@Parameter(names = { "--fail-fast" }, description = "Stop starting tests after the first failure")
	public boolean failFast = false;

	@Parameter(names = { "--retry" }, description = "Retry failing tests up to this many times", validateValueWith = NonNegativeValueValidator.class)
	public int retries = 0;

	@Parameter(names = { "-t", "--tag" }, description = "Tag expression; tests matching any expression run", splitter = NoSplitter.class, validateValueWith = TagExpressionValidator.class)
	public List<String> tagExpressions = new ArrayList<>();

	@Parameter(names = { "-m", "--match" }, description = "Regular expression matched against test names", splitter = NoSplitter.class, validateValueWith = PatternValidator.class)
	public List<String> namePatterns = new ArrayList<>();

	@Parameter(names = { "--seed" }, description = "Seed for shuffling tests without recorded durations")
	public Long seed;

	@Parameter(names = { "--cache-dir" }, description = "Directory of the duration cache")
	public Path cacheDir = DEFAULT_CACHE_DIR;

	@Parameter(names = { "--dry-run" }, description = "List the tests that would run")
	public boolean dryRun = false;

	@Parameter(names = { "-s", "--show-output" }, description = "Print the output of passing tests as well")
	public boolean showOutput = false;

	@Parameter(names = { "--no-progress" }, description = "Do not print each result as it finishes; failures are listed at the end")
	public boolean noProgress = false;

	public RunConfig toRunConfig() throws TagExpressionException {
		var tags = new ArrayList<TagExpression>();
		for(var expression : tagExpressions) {
			tags.add(TagExpression.parse(expression));
		}

		return RunConfig.builder()
			.workerCount(numWorkers)
			.noParallel(noParallel)
			.noCache(noCache)
			.failFast(failFast)
			.retries(retries)
			.tagExpressions(tags)
			.namePatterns(namePatterns)
			.seed(seed)
			.build();
	}

	public static final class NoSplitter implements IParameterSplitter {
		@Override
		public List<String> split(String value) {
			return List.of(value);
		}
	}

	public static final class NonNegativeValueValidator implements IValueValidator<Integer> {
		@Override
		public void validate(String name, Integer value) throws ParameterException {
			if(value < 0) {
				throw new ParameterException(name + " must not be negative: " + value);
			}
		}
	}

	public sealed static abstract class ExpressionValueValidatorBase implements IValueValidator<List<String>> {

		protected abstract void check(String expression) throws ParameterException;

		@Override
		public void validate(String name, List<String> value) throws ParameterException {
			for(var expression : value) {
				check(expression);
			}
		}
	}

	public final static class TagExpressionValidator extends ExpressionValueValidatorBase {
		@Override
		protected void check(String expression) throws ParameterException {
			try {
				TagExpression.parse(expression);
			}
			catch(TagExpressionException e) {
				throw new ParameterException("Invalid tag expression: " + e.getMessage());
			}
		}
	}

	public final static class PatternValidator extends ExpressionValueValidatorBase {
		@Override
		protected void check(String expression) throws ParameterException {
			try {
				Pattern.compile(expression);
			}
			catch(PatternSyntaxException e) {
				throw new ParameterException("Invalid name pattern: " + e.getDescription() + " in " + expression);
			}
		}
	}
}
