package net.salescoach.application.research;

import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Renders the research brief prompts. Optional sections appear only when the rep supplied
 * the matching context.
 */
@Component
public class ResearchPromptBuilder {

    static final String SYSTEM_PROMPT = """
        You are a seasoned marketing and sales intelligence expert with long experience in
        enterprise sales and competitive intelligence. Research a company and provide actionable
        intelligence that helps close deals.

        Approach:
        1. Synthesize what you know about the company
        2. Identify specific pain points based on their industry and context
        3. Analyze any stakeholders provided
        4. Connect their likely challenges to potential solutions
        5. Provide specific conversation hooks

        Style:
        - Specific and actionable, not generic
        - Bullet points for easy scanning
        - Say so when you are uncertain rather than inventing facts
        """;

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String buildUserPrompt(AccountResearchRequest request) {
        List<String> sections = new ArrayList<>();
        if (StringUtils.hasText(request.website())) {
            sections.add("**Website**: " + request.website().trim());
        }
        if (StringUtils.hasText(request.industry())) {
            sections.add("**Industry**: " + request.industry().trim());
        }
        if (!request.stakeholders().isEmpty()) {
            StringBuilder people = new StringBuilder("**Key People**:");
            for (AccountResearchRequest.StakeholderHint hint : request.stakeholders()) {
                people.append("\n- ").append(hint.name());
                if (StringUtils.hasText(hint.title())) {
                    people.append(" (").append(hint.title()).append(')');
                }
                if (StringUtils.hasText(hint.role())) {
                    people.append(" - ").append(hint.role());
                }
            }
            sections.add(people.toString());
        }
        if (StringUtils.hasText(request.productPitch())) {
            sections.add("**What We're Selling**: " + request.productPitch().trim());
        }
        if (StringUtils.hasText(request.dealStage())) {
            sections.add("**Deal Stage**: " + request.dealStage().trim());
        }
        if (StringUtils.hasText(request.knownChallenges())) {
            sections.add("**Known Challenges**: " + request.knownChallenges().trim());
        }
        if (StringUtils.hasText(request.additionalNotes())) {
            sections.add("**Additional Context**: " + request.additionalNotes().trim());
        }

        String companyName = request.companyName().trim();
        StringBuilder prompt = new StringBuilder("# Research Request: ").append(companyName);
        if (!sections.isEmpty()) {
            prompt.append("\n\n## Context Provided by Sales Rep\n").append(String.join("\n\n", sections));
        }
        prompt.append("\n\n---\n\nProvide sales intelligence in the following structure:\n\n");
        prompt.append("""
            ## Company Overview
            - What they do, size, headquarters, market position
            - Recent news or notable changes

            ## Industry Analysis & Pain Points
            - Top 3-5 challenges companies in this industry face
            """);
        prompt.append("- How these challenges apply to ").append(companyName).append("\n\n");
        if (!request.stakeholders().isEmpty()) {
            prompt.append("""
                ## Stakeholder Insights
                For each key person: likely priorities, what they care about, how to tailor the
                message, and questions to ask them.

                """);
        }
        prompt.append("""
            ## Sales Conversation Hooks
            - 3-5 talking points tailored to this company

            ## Discovery Questions
            - 8-10 questions uncovering budget, timeline, decision process and pain

            """);
        if (StringUtils.hasText(request.productPitch())) {
            prompt.append("""
                ## Solution Alignment
                - How the offering connects to their needs, and likely objections

                """);
        }
        prompt.append("""
            ## Signals to Watch
            - Hiring, technology and funding moves that indicate buying intent

            ## Risks & Considerations
            - Blockers, competitive threats, timing
            """);
        return prompt.toString();
    }
}
