/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */
package me.golemcore.handoff.domain.capability.product;

import java.util.List;
import java.util.Map;

/**
 * Catalog of the product-management authoring capabilities. Each one writes a
 * draft artifact of a fixed type; the optional metadata fields are stored on
 * the artifact as supplied.
 */
public enum ArtifactAuthoring {

    CREATE_PRODUCT_STRATEGY("createProductStrategy", "strategy",
            "Strategy Architect: develop product strategy with Playing to Win and Crossing the Chasm. "
                    + "Defines winning aspiration, target markets and defensible competitive position.",
            field("strategicHorizon", enumSchema(
                    "Strategic horizon: now (0-6mo), next (6-18mo), later (18mo+)", "now", "next", "later"))),

    EVALUATE_BUILD_STRATEGY("evaluateBuildStrategy", "build_analysis",
            "Strategic Build Analyst: separate Leverage work from Neutral and Overhead work "
                    + "so the team builds the right things."),

    APPLY_DECISION_FRAMEWORK("applyDecisionFramework", "decision_analysis",
            "Decision Frameworks Advisor: apply probabilistic thinking and structured decisioning "
                    + "to a difficult strategic decision.",
            field("decisionStatement", stringSchema("The specific decision being analyzed"))),

    ASSESS_SHIP_READINESS("assessShipReadiness", "ship_decision",
            "Ship Decision Advisor: decide when and how to ship, manage technical debt "
                    + "and plan a gradual rollout."),

    ANALYZE_COMPETITION("analyzeCompetition", "competitive_analysis",
            "Competition Research Analyst: map the competitive landscape, threats and opportunities "
                    + "with evidence-based research.",
            field("competitors", arraySchema("List of competitors being analyzed")),
            field("focusAreas", arraySchema("Specific areas to focus on (e.g., pricing, features, GTM)"))),

    SCOPE_MVP("scopeMvp", "mvp_scope",
            "MVP and Feature Launch Specialist: scope an idea down to a working prototype "
                    + "with AI-first thinking and complete experience design."),

    BUILD_PERSONA_ICP("buildPersonaIcp", "persona_icp",
            "Customer Research Analyst: develop the Ideal Customer Profile, personas and segmentation.",
            field("analysisScope", enumSchema(
                    "Scope: ICP only, personas only, or full analysis", "icp", "personas", "full"))),

    PLAN_USER_RESEARCH("planUserResearch", "user_research",
            "User Research Analyst: plan, conduct and synthesize qualitative user interviews.",
            field("researchObjective", stringSchema("The primary research objective"))),

    ANALYZE_PRODUCT_DATA("analyzeProductData", "data_analysis",
            "Data Analyst: analyze product and business metrics to validate hypotheses.",
            field("analysisType", stringSchema("Type of analysis (e.g., funnel, cohort, AARRR, North Star)"))),

    DESIGN_USER_FLOW("designUserFlow", "user_flow",
            "Flow Designer: map user flows, customer journeys and service blueprints, "
                    + "identifying friction points.",
            field("flowType", enumSchema("Type of flow design", "user_flow", "journey_map", "service_blueprint"))),

    DESIGN_UX_UI("designUxUi", "ux_design",
            "UX/UI Designer: translate requirements into design specifications and wireframes.",
            field("designScope", stringSchema("Scope of the design (e.g., specific page, component, or flow)"))),

    DESIGN_AI_FEATURE("designAiFeature", "ai_feature_spec",
            "AI Product Specialist: specify an AI-native feature with evals as product specifications."),

    CREATE_GROWTH_STRATEGY("createGrowthStrategy", "growth_strategy",
            "Growth Product Designer: embed growth loops, activation and retention into the product."),

    CREATE_LAUNCH_PLAN("createLaunchPlan", "launch_plan",
            "Launch Strategist: plan a product or feature launch with positioning, messaging, "
                    + "channel plan and success metrics.",
            field("launchTier", enumSchema(
                    "Launch tier: major (full GTM), medium (targeted), minor (release notes)",
                    "major", "medium", "minor"))),

    CREATE_NARRATIVE("createNarrative", "narrative",
            "Strategic Storyteller: craft a strategic product narrative, pitch or presentation.",
            field("audience", stringSchema("Target audience for the narrative (e.g., board, team, investors)"))),

    PRIORITIZE_ITEMS("prioritizeItems", "prioritization",
            "Prioritization Analyst: make defensible prioritization decisions with RICE and related frameworks.",
            field("framework", enumSchema("Scoring framework to apply",
                    "rice", "ice", "moscow", "opportunity", "value_effort")));

    private final String capabilityName;
    private final String artifactType;
    private final String description;
    private final List<MetadataField> metadataFields;

    ArtifactAuthoring(String capabilityName, String artifactType, String description,
            MetadataField... metadataFields) {
        this.capabilityName = capabilityName;
        this.artifactType = artifactType;
        this.description = description;
        this.metadataFields = List.of(metadataFields);
    }

    public String getCapabilityName() {
        return capabilityName;
    }

    public String getArtifactType() {
        return artifactType;
    }

    public String getDescription() {
        return description;
    }

    public List<MetadataField> getMetadataFields() {
        return metadataFields;
    }

    /**
     * Optional argument stored in the artifact metadata.
     */
    public record MetadataField(String name, Map<String, Object> schema) {
    }

    private static MetadataField field(String name, Map<String, Object> schema) {
        return new MetadataField(name, schema);
    }

    private static Map<String, Object> stringSchema(String description) {
        return Map.of("type", "string", "description", description);
    }

    private static Map<String, Object> arraySchema(String description) {
        return Map.of("type", "array", "items", Map.of("type", "string"), "description", description);
    }

    private static Map<String, Object> enumSchema(String description, String... values) {
        return Map.of("type", "string", "enum", List.of(values), "description", description);
    }
}
