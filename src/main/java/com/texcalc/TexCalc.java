package com.texcalc;

import com.texcalc.eval.EvaluationResult;
import com.texcalc.grading.AnswerVerifier;
import com.texcalc.grading.QuestionType;
import com.texcalc.grading.VerificationResult;
import com.texcalc.input.ExpressionListReader;
import com.texcalc.output.NumberFormatter;
import com.texcalc.output.ResultJsonWriter;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "texcalc", mixinStandardHelpOptions = true, version = "1.0",
         description = "Evaluate LaTeX math expressions to numbers")
public class TexCalc implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(TexCalc.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_ERROR = 2;

    @Parameters(arity = "0..*", description = "Expressions to evaluate (default: one per line from stdin)")
    private List<String> expressions;

    @Option(names = {"-b", "--batch"}, description = "JSON file holding an array of expressions")
    private File batchFile;

    @Option(names = {"-j", "--json"}, description = "Print each result as a JSON object")
    private boolean jsonOutput = false;

    @Option(names = {"--pretty"}, description = "Indent JSON output")
    private boolean prettyPrint = false;

    @Option(names = {"-p", "--precision"}, description = "Significant digits shown (default: ${DEFAULT-VALUE})")
    private int precision = NumberFormatter.DEFAULT_SIGNIFICANT_DIGITS;

    @Option(names = {"-a", "--expected"}, description = "Grade every expression against this answer")
    private String expectedAnswer;

    @Option(names = {"-t", "--type"}, description = "Question type when grading: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private QuestionType questionType = QuestionType.BLANK;

    @Option(names = {"--tolerance"}, description = "Numeric tolerance when grading (default: ${DEFAULT-VALUE})")
    private double tolerance = AnswerVerifier.DEFAULT_TOLERANCE;

    private final InputStream stdin;
    private final PrintStream stdout;
    private final PrintStream stderr;

    public TexCalc() {
        this(System.in, System.out, System.err);
    }

    TexCalc(InputStream stdin, PrintStream stdout, PrintStream stderr) {
        this.stdin = stdin;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    public static void main(String[] args) {
        int exitCode = newCommandLine(new TexCalc()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine(TexCalc command) {
        return new CommandLine(command)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExitCodeExceptionMapper(e -> EXIT_ERROR);
    }

    @Override
    public Integer call() {
        try {
            NumberFormatter formatter = new NumberFormatter(precision);
            LatexCalculator calculator = new LatexCalculator(formatter);
            ResultJsonWriter jsonWriter = new ResultJsonWriter(formatter, prettyPrint);

            MutableList<String> inputs = collectInputs();

            if (expectedAnswer != null) {
                return grade(inputs, new AnswerVerifier(calculator, tolerance), jsonWriter);
            }

            boolean allSucceeded = true;
            for (String input : inputs) {
                EvaluationResult result = calculator.evaluate(input);
                allSucceeded &= result.isSuccess();
                if (jsonOutput) {
                    stdout.println(jsonWriter.write(result));
                } else if (result instanceof EvaluationResult.Success success) {
                    stdout.println(formatter.format(success.value()));
                } else if (result instanceof EvaluationResult.Failure failure) {
                    stdout.println("error: " + failure.message());
                }
            }
            return allSucceeded ? EXIT_OK : EXIT_FAILED;
        } catch (IOException | IllegalArgumentException e) {
            log.debug("texcalc failed", e);
            stderr.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private int grade(MutableList<String> inputs, AnswerVerifier verifier, ResultJsonWriter jsonWriter) {
        boolean allCorrect = true;
        for (String input : inputs) {
            VerificationResult verdict = verifier.verify(input, expectedAnswer, questionType);
            allCorrect &= verdict.correct();
            if (jsonOutput) {
                stdout.println(jsonWriter.write(input, verdict));
            } else {
                stdout.println(verdict.correct() ? "correct" : "incorrect");
            }
        }
        return allCorrect ? EXIT_OK : EXIT_FAILED;
    }

    private MutableList<String> collectInputs() throws IOException {
        MutableList<String> inputs = Lists.mutable.empty();
        if (expressions != null) {
            inputs.addAll(expressions);
        }
        if (batchFile != null) {
            try (InputStream in = new FileInputStream(batchFile)) {
                inputs.addAll(new ExpressionListReader().read(in));
            }
        }
        if ((expressions == null || expressions.isEmpty()) && batchFile == null) {
            BufferedReader reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    inputs.add(line);
                }
            }
        }
        return inputs;
    }
}
