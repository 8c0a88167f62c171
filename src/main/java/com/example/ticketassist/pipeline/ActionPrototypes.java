package com.example.ticketassist.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.example.ticketassist.model.ActionRequired;

/**
 * Canonical exemplar phrases per action. Iteration order matters: on an exact similarity tie
 * the action listed first wins.
 */
public final class ActionPrototypes {

    public static final Map<ActionRequired, List<String>> DEFAULT = build();

    private ActionPrototypes() {
    }

    private static Map<ActionRequired, List<String>> build() {
        Map<ActionRequired, List<String>> p = new LinkedHashMap<>();
        p.put(ActionRequired.ESCALATE_TO_ABUSE_TEAM, List.of(
            "Domain suspended for phishing, malware, or spam",
            "Abuse complaint requires review by the Abuse Team",
            "Support must not manually reactivate this domain",
            "This suspension is due to a policy violation or abuse report"));
        p.put(ActionRequired.ESCALATE_TO_BILLING, List.of(
            "Billing dispute involving charges, refunds, or invoices",
            "Customer reports duplicate charge or payment failure",
            "Domain suspended due to unpaid invoice or payment issue",
            "Refund eligibility must be reviewed by Billing Team"));
        p.put(ActionRequired.ESCALATE_TO_TECHNICAL, List.of(
            "Domain is active but DNS is not resolving",
            "Service outage or technical failure after renewal",
            "System issue where services remain offline unexpectedly",
            "Technical investigation required for infrastructure failure"));
        p.put(ActionRequired.ESCALATE_TO_SUPPORT, List.of(
            "Domain suspended due to WHOIS verification issues",
            "Customer reports domain still suspended after completing WHOIS verification",
            "Support needs to review account status and system flags",
            "Manual review required for non-abuse domain suspension"));
        p.put(ActionRequired.CUSTOMER_ACTION_REQUIRED, List.of(
            "Customer must verify WHOIS email address",
            "Registrant information must be updated to restore domain",
            "User needs to unlock the domain before transfer",
            "Customer must complete remediation steps"));
        p.put(ActionRequired.FOLLOW_UP_REQUIRED, List.of(
            "Reactivation will occur after review is completed",
            "Support will monitor and follow up after verification",
            "Additional review time is required before action"));
        p.put(ActionRequired.NONE, List.of(
            "General informational question about domains",
            "Explanation of policy without required action",
            "Customer is asking how the system works",
            "No action is required from support or customer"));
        return Collections.unmodifiableMap(p);
    }
}
