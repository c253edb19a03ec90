package com.cypherscan.core.analyzer;

import com.cypherscan.core.api.IAnalyzer;
import com.cypherscan.core.model.Severity;

import java.util.List;

/**
 * 기본 제공 Solidity 휴리스틱 analyzer 묶음.
 * 카테고리가 일부 겹치도록 구성되어 있어서(reentrancy, tx_origin 등) 서로 교차 투표가 일어난다.
 */
public final class BuiltinAnalyzers {
    private BuiltinAnalyzers() {}

    public static List<IAnalyzer> all() {
        return List.of(staticCode(), accessControl(), dangerousFunctions(), defiRisk());
    }

    public static PatternAnalyzer staticCode() {
        return new PatternAnalyzer("static-code", List.of(
                PatternRule.of("reentrancy", Severity.HIGH, "\\.call(\\{|\\()", 70,
                        "Potential Reentrancy Risk via .call()",
                        "External call made with .call(); state changes after it may be re-entered.",
                        "Follow checks-effects-interactions and guard with a nonReentrant modifier."),
                PatternRule.of("overflow", Severity.MEDIUM, "(\\+\\+|--|\\+=|-=)", 70,
                        "Potential Integer Overflow/Underflow",
                        "Arithmetic update that can wrap on compilers older than 0.8 or inside unchecked blocks.",
                        "Use Solidity >= 0.8 checked arithmetic or SafeMath."),
                PatternRule.of("version", Severity.MEDIUM, "pragma solidity.*(0\\.[4-7]\\.|0\\.8\\.[0-9][^0-9])", 90,
                        "Outdated Solidity Version Detected",
                        "The pragma allows a compiler version with known bugs.",
                        "Pin a recent 0.8.x compiler release.")));
    }

    public static PatternAnalyzer accessControl() {
        return new PatternAnalyzer("access-control", List.of(
                PatternRule.of("access_control", Severity.HIGH, "\\b(owner|admin)\\s*=[^=]", 75,
                        "Potential Missing Access Control",
                        "Privileged state is assigned; verify the enclosing function is restricted.",
                        "Restrict with onlyOwner or a role-based access control modifier."),
                PatternRule.of("privilege_escalation", Severity.MEDIUM, "transferOwnership|addOwner", 70,
                        "Privilege Escalation Functions Detected",
                        "Functions that change ownership are a direct privilege escalation path.",
                        "Use two-step ownership transfer and emit events for every change."),
                PatternRule.of("tx_origin", Severity.HIGH, "tx\\.origin", 90,
                        "tx.origin Used for Authorization",
                        "tx.origin authorizes the original sender, enabling phishing through intermediate contracts.",
                        "Use msg.sender for authorization checks.")));
    }

    public static PatternAnalyzer dangerousFunctions() {
        return new PatternAnalyzer("dangerous-functions", List.of(
                PatternRule.of("delegatecall", Severity.HIGH, "delegatecall", 95,
                        "Dangerous delegatecall Usage",
                        "delegatecall executes foreign code against this contract's storage.",
                        "Only delegatecall into trusted, audited, immutable targets."),
                PatternRule.of("tx_origin", Severity.HIGH, "tx\\.origin", 95,
                        "Dangerous tx.origin Usage for Authorization",
                        "tx.origin based checks can be bypassed by a malicious intermediate contract.",
                        "Replace tx.origin with msg.sender."),
                PatternRule.of("selfdestruct", Severity.HIGH, "selfdestruct|suicide", 95,
                        "selfdestruct Function Detected",
                        "The contract can be destroyed and its balance forcibly sent elsewhere.",
                        "Remove selfdestruct or protect it behind strict multi-party authorization."),
                PatternRule.of("reentrancy", Severity.HIGH, "\\.call\\{value:|\\.call\\.value\\(", 85,
                        "Value Transfer via Low-Level Call",
                        "Ether is sent through a low-level call that forwards all remaining gas.",
                        "Update state before the call and apply a reentrancy guard.")));
    }

    public static PatternAnalyzer defiRisk() {
        return new PatternAnalyzer("defi-risk", List.of(
                PatternRule.of("flashloan", Severity.HIGH, "flashLoan|borrow", 80,
                        "Flash Loan Implementation Detected",
                        "Flash loan logic can be abused to manipulate state within one transaction.",
                        "Validate invariants at the end of the loan callback and avoid spot-price reads."),
                PatternRule.of("oracle_manipulation", Severity.HIGH, "getPrice\\(\\)", 75,
                        "Potential Single Oracle Dependency",
                        "A single price source can be manipulated.",
                        "Use time-weighted or multi-source oracles."),
                PatternRule.of("front_running", Severity.MEDIUM, "approve\\(", 70,
                        "Potential Front-Running Risk with approve()",
                        "Changing an allowance from non-zero to non-zero is open to front-running.",
                        "Use increaseAllowance/decreaseAllowance or reset to zero first."),
                PatternRule.of("unlimited_approval", Severity.MEDIUM, "approve\\(\\w+,\\s*type\\(uint256\\)\\.max\\)", 80,
                        "Unlimited ERC20 Approval Pattern",
                        "An infinite allowance exposes all tokens if the spender is compromised.",
                        "Approve only the amount required for the operation.")));
    }
}
