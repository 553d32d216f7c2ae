package com.casewright.core.llm;

import com.casewright.core.model.FunctionPoint;

/**
 * Prompt text for the two LLM-backed stages. Both prompts pin the exact JSON shape
 * the parsers read back.
 */
public final class PromptTemplates {

    private PromptTemplates() {}

    public static String functionModuleExtraction(String requirementDoc) {
        return """
                You are a senior QA analyst. Read the requirement document below and list every
                independently testable function module it describes.

                For each module return:
                - "name": short module name, using the document's own wording
                - "description": one or two sentences on what the module does
                - "keywords": 3 to 6 distinctive terms that appear in the document near this module
                - "exact_phrases": 1 to 3 phrases copied verbatim from the document
                - "section_hint": the heading the module is described under, if any

                Respond with JSON only, no commentary, in exactly this shape:
                {"function_modules": [{"name": "", "description": "", "keywords": [], "exact_phrases": [], "section_hint": ""}]}

                Requirement document:
                """ + requirementDoc;
    }

    public static String testCaseGeneration(FunctionPoint point, String context) {
        String description = point.description() == null ? "" : point.description();
        return """
                You are a senior manual tester. Write functional test cases for the function module
                below, using only behaviour described in the requirement excerpt.

                Rules:
                - every step is an action a tester performs in the product UI
                - never reference back-end systems, databases, APIs, scripts or operations consoles
                - each case has at least 3 steps
                - expected results are concrete and observable, never "works as expected"
                - priority is one of "high", "medium", "low"

                Respond with JSON only, no commentary, in exactly this shape:
                {"test_cases": [{"case_name": "", "description": "", "preconditions": "", "steps": [""], "expected_result": "", "priority": ""}]}

                Function module: %s
                Description: %s

                Requirement excerpt:
                %s
                """.formatted(point.name(), description, context);
    }
}
