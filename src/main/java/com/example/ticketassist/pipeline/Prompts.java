package com.example.ticketassist.pipeline;

final class Prompts {

    static final String QUERY_REWRITE = """
        You are a query rewriting assistant for a customer support knowledge base.

        Rewrite the ticket into clear, retrieval-friendly search queries.

        Rules:
        - Use neutral, professional language
        - Use support terminology (domain suspension, WHOIS, abuse, billing, etc.)
        - Split multi-issue tickets into multiple queries
        - Do NOT answer
        - Do NOT add facts
        - Output one query per line, no bullets, no numbering

        Ticket:
        \"\"\"%s\"\"\"

        Queries:
        """;

    static final String GROUNDED_ANSWER = """
        You are a support assistant.

        TASK:
        - Generate a clear, accurate answer to the customer ticket.
        - Use the provided documentation context.
        - Do NOT cite references.
        - Do NOT mention sources.
        - Do NOT suggest internal escalation unless explicitly stated in docs.
        - If you don't know strictly say that you don't know

        Return STRICT JSON:

        {
          "answer": "..."
        }

        Ticket:
        %s

        Context:
        %s
        """;

    static final String NO_CONTEXT = "No relevant documentation found.";

    private Prompts() {
    }
}
