package com.github.spud.sage.domain.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sage.domain.fixfinder.FixFinderContext;
import com.github.spud.sage.domain.simulation.ScenarioSimulator;
import com.github.spud.sage.domain.simulation.SimulationResult;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;

/**
 * simulate_scenario：对当前场景的副本应用变更并重新检查资格
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimulateScenarioTool implements FixFinderTool {

  public static final String NAME = "simulate_scenario";

  private static final ToolDefinition DEFINITION = DefaultToolDefinition.builder()
    .name(NAME)
    .description("Test a what-if scenario by simulating changes to the loan parameters and "
      + "checking if it would resolve eligibility violations. Use this to quantify the impact of "
      + "potential fixes.")
    .inputSchema("""
      {
          "type": "object",
          "properties": {
              "changes": {
                  "type": "object",
                  "description": "Key-value pairs of loan parameters to modify. Valid keys: credit_score, annual_income, loan_amount, property_value, monthly_debt_payments.",
                  "additionalProperties": {"type": "number"}
              },
              "description": {
                  "type": "string",
                  "description": "Brief description of what this simulation represents (e.g., 'Pay down $5,000 in debt')."
              }
          },
          "required": ["changes", "description"]
      }
      """)
    .build();

  private final ScenarioSimulator scenarioSimulator;

  @Override
  public ToolDefinition definition() {
    return DEFINITION;
  }

  @Override
  public ToolOutcome execute(JsonNode arguments, FixFinderContext ctx) {
    Map<String, Double> changes = numericChanges(arguments.path("changes"));
    String description = arguments.path("description").asText("");

    SimulationResult result = scenarioSimulator.simulate(ctx.getScenario(), changes, description);
    return ToolOutcome.builder()
      .summary(scenarioSimulator.summarize(result))
      .simulation(result)
      .build();
  }

  /**
   * Numbers and numeric strings are accepted, anything else is skipped
   */
  static Map<String, Double> numericChanges(JsonNode changes) {
    Map<String, Double> values = new LinkedHashMap<>();
    if (changes == null || !changes.isObject()) {
      return values;
    }
    Iterator<Map.Entry<String, JsonNode>> fields = changes.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode value = field.getValue();
      if (value.isNumber()) {
        values.put(field.getKey(), value.asDouble());
      } else if (value.isTextual()) {
        try {
          values.put(field.getKey(), Double.parseDouble(value.asText().replace(",", "").trim()));
        } catch (NumberFormatException e) {
          log.debug("Skipping non-numeric simulation change {}={}", field.getKey(), value);
        }
      }
    }
    return values;
  }
}
