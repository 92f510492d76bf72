package com.notes.ingestion.extraction;

/**
 * Prompt asking the model for the categorisation and extraction JSON read by
 * {@link AnalysisResponseParser}.
 */
final class AnalysisPrompt {

    private AnalysisPrompt() {
    }

    static String forText(String text) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You analyse notes about the architecture and construction industry.\n");
        prompt.append("Decide which single category the note describes and extract its fields.\n\n");

        prompt.append("Categories:\n");
        prompt.append("- office: architecture or engineering firms, practices and studios ");
        prompt.append("(names, founding year, headquarters, headcount, specialisations)\n");
        prompt.append("- project: buildings, developments and construction projects ");
        prompt.append("(name, location, budget, status, building type)\n");
        prompt.append("- regulation: building codes, zoning laws and standards ");
        prompt.append("(jurisdiction, effective date, type)\n");
        prompt.append("- unknown: only when the note fits none of the above\n\n");

        prompt.append("Always give both city and country for any location you can infer. ");
        prompt.append("Use \"Unknown\" only as a last resort.\n\n");

        prompt.append("Text: \"").append(text).append("\"\n\n");

        prompt.append("Respond with JSON only, in this shape:\n");
        prompt.append("{\n");
        prompt.append("  \"categorization\": {\"category\": \"office|project|regulation|unknown\", ");
        prompt.append("\"confidence\": 0.0, \"reasoning\": \"...\"},\n");
        prompt.append("  \"extraction\": {\n");
        prompt.append("    \"extractedData\": {\n");
        prompt.append("      \"name\": \"...\", \"officialName\": \"...\", \"founded\": 1967, \"status\": \"active\",\n");
        prompt.append("      \"location\": {\"headquarters\": {\"city\": \"...\", \"country\": \"...\"}, ");
        prompt.append("\"otherOffices\": [{\"city\": \"...\", \"country\": \"...\"}]},\n");
        prompt.append("      \"size\": {\"sizeCategory\": \"boutique|medium|large|global\", \"annualRevenue\": 0},\n");
        prompt.append("      \"specializations\": [], \"notableWorks\": [],\n");
        prompt.append("      \"projectName\": \"...\", \"details\": {\"projectType\": \"...\", \"description\": \"...\"},\n");
        prompt.append("      \"financial\": {\"budget\": 0, \"currency\": \"USD\"},\n");
        prompt.append("      \"jurisdiction\": {\"level\": \"city|state|country\", \"cityName\": \"...\", ");
        prompt.append("\"countryName\": \"...\"}, \"regulationType\": \"...\", \"effectiveDate\": \"YYYY-MM-DD\", ");
        prompt.append("\"description\": \"...\"\n");
        prompt.append("    },\n");
        prompt.append("    \"missingFields\": [],\n");
        prompt.append("    \"employees\": [{\"name\": \"...\", \"role\": \"...\", \"description\": \"...\", ");
        prompt.append("\"expertise\": [], \"location\": {\"city\": \"...\", \"country\": \"...\"}}],\n");
        prompt.append("    \"employeeDistribution\": {\"architects\": 0, \"engineers\": 0, ");
        prompt.append("\"designers\": 0, \"administrative\": 0},\n");
        prompt.append("    \"clients\": [], \"technology\": [], \"financials\": [], \"supplyChain\": [],\n");
        prompt.append("    \"landData\": [], \"cityData\": [], \"projectData\": [], \"companyStructure\": [],\n");
        prompt.append("    \"divisionPercentages\": [], \"newsArticles\": [], \"politicalContext\": []\n");
        prompt.append("  }\n");
        prompt.append("}\n");
        prompt.append("Only fill the extractedData fields that belong to the chosen category. ");
        prompt.append("Do not report an employee count; list named employees instead.\n");
        return prompt.toString();
    }
}
