import org.junit.jupiter.api.Test;

import com.claro.script.parser.ExpressionEvaluator;
import com.claro.script.parser.ExpressionException;
import com.claro.script.parser.Value;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ClaroExpressionTest {

    private final ExpressionEvaluator ev = new ExpressionEvaluator();
    private final Map<String, Value> vars = new HashMap<>();

    private Value eval(String expression) {
        return ev.evaluate(expression, vars);
    }

    private String repr(String expression) {
        return eval(expression).repr();
    }

    @Test
    public void arithmetic_precedenceAndIntegerSemantics() {
        assertEquals("14", repr("2 + 3 * 4"));
        assertEquals("20", repr("(2 + 3) * 4"));
        assertEquals("2.5", repr("5 / 2"));
        assertEquals("2", repr("5 // 2"));
        assertEquals("-3", repr("-5 // 2"));
        assertEquals("1", repr("-5 % 3"));
        assertEquals("1024", repr("2 ** 10"));
        assertEquals("512", repr("2 ** 3 ** 2"));
        assertEquals("0.5", repr("2 ** -1"));
        assertEquals("3.5", repr("1.5 + 2"));
    }

    @Test
    public void comparisonAndLogic() {
        assertEquals("True", repr("1 < 2 and 2 <= 2"));
        assertEquals("False", repr("not (3 > 2)"));
        assertEquals("True", repr("1 == 1.0"));
        assertEquals("True", repr("'a' != 'b' || False"));
        assertEquals("True", repr("'abc' < 'abd'"));
        // and / or return an operand
        assertEquals("'fallback'", repr("'' or 'fallback'"));
        assertEquals("0", repr("0 and undefinedIsNotEvaluated"));
    }

    @Test
    public void strings_concatenationAndRepetition() {
        vars.put("n", Value.integer(3));
        assertEquals("count: 3", eval("'count: ' + n").asString());
        assertEquals("ababab", eval("'ab' * n").asString());
        assertEquals("say \"hi\"\n", eval("\"say \\\"hi\\\"\\n\"").asString());
        assertEquals("e", eval("'hello'[1]").asString());
        assertEquals("o", eval("'hello'[-1]").asString());
    }

    @Test
    public void listsAndDicts() {
        vars.put("xs", Value.list(Arrays.asList(Value.integer(1), Value.integer(2))));
        assertEquals("[1, 2, 3]", repr("xs + [3]"));
        assertEquals("2", repr("xs[-1]"));
        assertEquals("True", repr("2 in xs"));
        assertEquals("{'a': 1, 'b': [1, 2]}", repr("{a: 1, 'b': xs,}"));
        assertEquals("True", repr("'a' in {'a': None}"));
        assertEquals("'v'", repr("{'k': {'n': 'v'}}['k']['n']"));
        assertEquals("[]", repr("[]"));
    }

    @Test
    public void literalsAreCaseInsensitive() {
        assertEquals("True", repr("TRUE"));
        assertEquals("False", repr("false"));
        assertEquals("None", repr("null"));
        assertEquals("None", repr("None"));
    }

    @Test
    public void builtins() {
        assertEquals("3", repr("len([1, 2, 3])"));
        assertEquals("'12'", repr("str(12)"));
        assertEquals("42", repr("int('42')"));
        assertEquals("3", repr("int(3.9)"));
        assertEquals("2.0", repr("float(2)"));
        assertEquals("[0, 2, 4]", repr("range(0, 6, 2)"));
        assertEquals("['x', 'y']", repr("keys({x: 1, y: 2})"));
        assertEquals("5", repr("abs(-5)"));
        assertEquals("1", repr("min(3, 1, 2)"));
        assertEquals("9", repr("max([4, 9, 2])"));
        assertEquals("3", repr("round(2.6)"));
        assertEquals("2.35", repr("round(2.346, 2)"));
        assertEquals("'ABC'", repr("upper('abc')"));
        assertEquals("'abc'", repr("lower('ABC')"));
        assertEquals("'list'", repr("typeof([])"));
    }

    @Test
    public void hostRegisteredFunction() {
        ev.registerFunction("twice", args -> Value.integer(args.get(0).asInt() * 2));
        assertTrue(ev.hasFunction("twice"));
        assertEquals("8", repr("twice(4)"));
    }

    @Test
    public void errors_carryExpressionText() {
        List<String> bad = Arrays.asList(
                "undefinedName",
                "1 / 0",
                "1 +",
                "'unterminated",
                "[1, 2][5]",
                "{'a': 1}['b']",
                "'a' - 1",
                "nosuchfn(1)",
                "x = 1",
                "9223372036854775807 + 1",
                "len(1)");
        for (String expression : bad) {
            ExpressionException e = assertThrows(ExpressionException.class, () -> eval(expression), expression);
            assertEquals(expression, e.getExpression(), expression);
        }
    }

    @Test
    public void emptyExpression_isError() {
        assertThrows(ExpressionException.class, () -> eval("   "));
    }
}
