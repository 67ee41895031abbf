package com.obelisk.tool.calculator;

import com.obelisk.tools.AbstractTool;
import com.obelisk.tools.ParameterType;
import com.obelisk.tools.ToolCategory;
import com.obelisk.tools.ToolDefinition;
import com.obelisk.tools.ToolExecutionContext;
import com.obelisk.tools.ToolExecutionException;
import com.obelisk.tools.ToolMetadata;
import com.obelisk.tools.ToolParameter;
import com.obelisk.tools.ToolResult;
import com.obelisk.tools.ToolValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Arithmetic on one or two operands: add, subtract, multiply, divide, power and sqrt.
 * The result is rounded to {@code precision} decimal places; the unrounded value is kept as {@code raw_result}.
 */
public final class CalculatorTool extends AbstractTool {

    public static final String NAME = "calculator";

    static final String KEY_OPERATION = "operation";
    static final String KEY_A = "a";
    static final String KEY_B = "b";
    static final String KEY_PRECISION = "precision";
    static final double MAX_OPERAND = 1e15;

    private static final ToolDefinition DEFINITION = ToolDefinition.builder(NAME)
            .description("Perform basic mathematical operations including addition, subtraction, "
                    + "multiplication, division, power, and square root")
            .version("1.0.0")
            .timeoutSeconds(10.0)
            .parameter(ToolParameter.builder(KEY_OPERATION, ParameterType.STRING)
                    .description("Mathematical operation to perform")
                    .required(true)
                    .enumValues((Object[]) Operation.wireNames())
                    .build())
            .parameter(ToolParameter.builder(KEY_A, ParameterType.NUMBER)
                    .description("First number (operand)")
                    .required(true)
                    .build())
            .parameter(ToolParameter.builder(KEY_B, ParameterType.NUMBER)
                    .description("Second number (operand). Not required for sqrt operation.")
                    .build())
            .parameter(ToolParameter.builder(KEY_PRECISION, ParameterType.INTEGER)
                    .description("Number of decimal places for the result")
                    .defaultValue(2)
                    .range(0.0, 10.0)
                    .build())
            .metadata(ToolMetadata.of(ToolCategory.MATH, "math", "arithmetic"))
            .build();

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    protected void preExecute(Map<String, Object> parameters, ToolExecutionContext context) {
        Operation operation = Operation.fromWire((String) parameters.get(KEY_OPERATION));
        double a = number(parameters.get(KEY_A));
        Object b = parameters.get(KEY_B);
        if (operation == Operation.SQRT) {
            if (a < 0) {
                throw new ToolValidationException("Square root of negative numbers is not supported", NAME,
                        Map.of(KEY_A, "Must be non-negative for sqrt operation"));
            }
        } else {
            if (b == null) {
                throw new ToolValidationException(
                        String.format("Parameter 'b' is required for %s operation", operation.wireName()), NAME,
                        Map.of(KEY_B, "Required for " + operation.wireName() + " operation"));
            }
            if (operation == Operation.DIVIDE && number(b) == 0.0) {
                throw new ToolValidationException("Division by zero is not allowed", NAME,
                        Map.of(KEY_B, "Cannot be zero for division operation"));
            }
        }
        if (Math.abs(a) > MAX_OPERAND || (b != null && Math.abs(number(b)) > MAX_OPERAND)) {
            throw new ToolValidationException("Numbers too large for calculation", NAME,
                    Map.of("range", "Numbers must be between -1.0E15 and 1.0E15"));
        }
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolExecutionContext context) {
        Operation operation = Operation.fromWire((String) parameters.get(KEY_OPERATION));
        double a = number(parameters.get(KEY_A));
        Double b = parameters.get(KEY_B) != null ? number(parameters.get(KEY_B)) : null;
        int precision = ((Number) parameters.get(KEY_PRECISION)).intValue();

        if (operation.isBinary() && b == null) {
            throw new ToolExecutionException("Invalid operation or missing required parameter: " + operation.wireName(), NAME);
        }
        double raw = operation.apply(a, b);
        if (Double.isNaN(raw) || Double.isInfinite(raw)) {
            log.warn("Calculator overflow: {} {} {}", a, operation.symbol(), b);
            return ToolResult.failure("Calculation result is too large to represent",
                    Map.of("error_type", "overflow", "operation", operation.wireName()));
        }
        // Rounds the shortest decimal form of the result, ties to even: 2.675 -> 2.68, 2.665 -> 2.66.
        double rounded = BigDecimal.valueOf(raw).setScale(precision, RoundingMode.HALF_EVEN).doubleValue();
        String expression = operation == Operation.SQRT
                ? operation.symbol() + a
                : a + " " + operation.symbol() + " " + b;

        Map<String, Object> operands = new LinkedHashMap<>();
        operands.put(KEY_A, a);
        if (b != null) operands.put(KEY_B, b);

        boolean whole = rounded == Math.rint(rounded);
        Map<String, Object> calculation = new LinkedHashMap<>();
        calculation.put("operation_type", operation.wireName());
        calculation.put("operand_count", b != null ? 2 : 1);
        calculation.put("result_type", whole ? "integer" : "decimal");
        if (operation == Operation.DIVIDE) {
            calculation.put("division_type", whole ? "exact" : "decimal");
        }
        if (operation == Operation.POWER && b == 2.0) {
            calculation.put("special_operation", "square");
        } else if (operation == Operation.POWER && b == 3.0) {
            calculation.put("special_operation", "cube");
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("operation", operation.wireName());
        data.put("expression", expression);
        data.put("operands", operands);
        data.put("result", rounded);
        data.put("raw_result", raw);
        data.put("precision", precision);
        data.put("session_id", context.getSessionId());
        data.put("calculation_metadata", calculation);

        log.info("Calculator operation completed: {} = {}", expression, rounded);
        return ToolResult.success(data, Map.of(
                "tool_version", DEFINITION.getVersion(),
                "operation_count", 1,
                "precision_used", precision));
    }

    private static double number(Object value) {
        return ((Number) value).doubleValue();
    }
}
