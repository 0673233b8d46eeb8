package com.prospectenhancer.enhancement.parser;

/**
 * Prompt templates for the model-backed field parsers. Placeholders are {@code {name}} tokens.
 */
public final class EnhancementPrompts {

    static final String NAICS_CLASSIFICATION = """
            You are a NAICS classification expert. Analyze ALL available procurement information to determine the TOP 3 most appropriate NAICS codes.

            PROCUREMENT INFORMATION:
            Title: "{title}"
            Description: "{description}"
            Agency: "{agency}"
            Contract Type: "{contract_type}"
            Set Aside: "{set_aside}"
            Estimated Value: "{estimated_value}"

            Classification Guidelines:
            1. Use NAICS 2022 edition codes (6-digit) - RETURN CODES ONLY, NO DESCRIPTIONS
            2. Analyze ALL provided information - title, description, agency, contract type, etc.
            3. Consider agency context (DOD=defense, HHS=healthcare, etc.)
            4. Common government categories:
               - IT Services: 541511, 541512, 541513, 541519
               - Construction: 236220, 237110, 237310, 237990
               - Professional Services: 541330, 541611, 541618, 541690, 541715
               - Manufacturing: 334111, 334220, 334511, 334516
               - Healthcare: 621111, 621511, 621610
               - Administrative: 561110, 561210, 561320, 561612
            5. Set-aside programs may indicate specific industry focus
            6. Be specific - use 6-digit codes, not 2-4 digit categories

            Return ONLY a valid JSON array with up to 3 codes:
            [
              {"code": "541511", "confidence": 0.85},
              {"code": "541512", "confidence": 0.70},
              {"code": "541519", "confidence": 0.60}
            ]

            Confidence scoring:
            - 0.9-1.0: Clear industry match with specific keywords/context
            - 0.7-0.89: Good match but some ambiguity
            - 0.5-0.69: Possible match, secondary service
            - <0.5: Weak match but potentially relevant""";

    static final String VALUE_PARSING = """
            You are a contract value parser. Extract and normalize the monetary value from the given text.

            Value Text: "{value_text}"

            Parsing Rules:
            1. Common patterns to recognize:
               - Ranges: "$1M-$5M", ">$250K to <$750K", "between $X and $Y", "$250,000 to $700,000"
               - Single values: "$2.5 million", "NTE $500K", "up to $10M"
               - Abbreviations: K=thousand, M/MM=million, B=billion
               - Multi-year: "5-year $10M" = $10M total (not $50M)
            2. For ranges return min (lower bound) and max (upper bound) and leave single null.
               ">$250K to <$750K" means min=250000, max=750000.
            3. For single values return single and leave min and max null.
            4. Parse each number in a range separately - don't repeat the first number.

            Return ONLY valid JSON (numbers only, no formatting), for example:
            {"single": null, "min": 1000000, "max": 5000000, "confidence": 0.9}""";

    static final String TITLE_ENHANCEMENT = """
            You are a government procurement title optimizer. Rewrite vague, unclear, or generic procurement titles into clear, descriptive titles that accurately reflect what is being procured.

            Original Title: "{title}"
            Description: "{description}"
            Agency: "{agency}"

            Guidelines:
            1. BE SPECIFIC: "Services" -> "IT Support Services", "Support" -> "Maintenance and Technical Support"
            2. INCLUDE KEY DETAILS from the description: technology or system names, location, duration when it matters
            3. USE ACTION-ORIENTED LANGUAGE: "Development of...", "Procurement of...", "Maintenance of..."
            4. KEEP GOVERNMENT CONTEXT: widely understood acronyms, security classifications, agency-specific terms
            5. LENGTH: 8-15 words

            Return ONLY valid JSON:
            {"enhanced_title": "Clear Descriptive Title Here", "confidence": 0.85, "reasoning": "Brief explanation of changes made"}

            Confidence guidelines:
            - 0.9-1.0: Original title was very vague, significant improvement made
            - 0.7-0.89: Moderate improvement, some ambiguity resolved
            - 0.5-0.69: Minor improvement, original was somewhat clear
            - <0.5: Original title was already clear, minimal changes needed""";

    private EnhancementPrompts() {
    }

    public static String naicsClassification(String title, String description, String agency, String contractType,
                                             String setAside, String estimatedValue) {
        return NAICS_CLASSIFICATION
                .replace("{title}", orDefault(title, "Not provided"))
                .replace("{description}", orDefault(description, "Not provided"))
                .replace("{agency}", orDefault(agency, "Not provided"))
                .replace("{contract_type}", orDefault(contractType, "Not provided"))
                .replace("{set_aside}", orDefault(setAside, "Not provided"))
                .replace("{estimated_value}", orDefault(estimatedValue, "Not provided"));
    }

    public static String valueParsing(String valueText) {
        return VALUE_PARSING.replace("{value_text}", orDefault(valueText, ""));
    }

    public static String titleEnhancement(String title, String description, String agency) {
        return TITLE_ENHANCEMENT
                .replace("{title}", orDefault(title, "No title provided"))
                .replace("{description}", orDefault(description, "No description available"))
                .replace("{agency}", orDefault(agency, "Unknown agency"));
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
