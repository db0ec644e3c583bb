/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements. See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership. The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.gp2.tracing.highlight;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.IntPredicate;

import org.gp2.tracing.step.TraceDirection;
import org.gp2.tracing.step.TraceStep;
import org.gp2.tracing.step.TraceStepType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the emphasis flag across the program tokens so that the token for the
 * step at the replay cursor is highlighted.
 *
 * <p>Searches are linear scans that start next to the current highlight and run
 * in the direction of travel. A stack of highlighted references lets a
 * procedure call return to its call site and lets a loop restart each
 * iteration from the top of its body.</p>
 *
 * <p>A then or else branch that the compiler materialised without any source
 * text is marked as a virtual step the first time it is met and never moves
 * the highlight.</p>
 */
public class TraceHighlighter {

    private static final Logger LOG = LoggerFactory.getLogger(TraceHighlighter.class);

    private final List<Token> tokens;
    private final String compilerPrefix;
    private final Deque<TokenReference> highlights = new ArrayDeque<>();
    private final Deque<Integer> conditionalKeywords = new ArrayDeque<>();

    public TraceHighlighter(List<Token> programTokens, String compilerPrefix) {
        this.tokens = List.copyOf(programTokens);
        this.compilerPrefix = compilerPrefix != null ? compilerPrefix : "";
        // Tokens belong to the editor and may still be emphasised by an earlier run.
        clearHighlights();
    }

    /**
     * Moves the highlight to the token for {@code step}, which has just become
     * the step at the cursor after travelling in {@code direction}.
     *
     * @param step the step at the cursor, or {@code null} at the end of the trace
     * @return the reference on top of the highlight stack, or {@code null} if there is none
     */
    public TokenReference update(TraceStep step, TraceDirection direction) {
        if (step == null) {
            finishTrace();
            return null;
        }
        if (step.isVirtualStep()) {
            return getCurrentHighlight();
        }

        boolean forwards = direction == TraceDirection.FORWARDS;
        // Forwards over an opening step, or backwards over a closing one.
        boolean entering = forwards != step.isEndOfContext();

        switch (step.getType()) {
            case RULE:
                if (entering) {
                    String ruleName = stripPrefix(step.getContextName());
                    replaceWithSearch(direction, i -> tokens.get(i).is(ProgramLexeme.IDENTIFIER, ruleName));
                }
                break;
            case RULE_SET: {
                ProgramLexeme brace = step.isEndOfContext() ? ProgramLexeme.CLOSE_BRACE : ProgramLexeme.OPEN_BRACE;
                replaceWithSearch(direction, i -> tokens.get(i).getLexeme() == brace);
                break;
            }
            case PROCEDURE:
                updateProcedure(step, direction, entering);
                break;
            case LOOP:
                updateLoop(direction, entering);
                break;
            case LOOP_ITERATION:
                if (entering && !step.isLoopBoundary()) {
                    restartIteration();
                }
                break;
            case IF_CONTEXT:
            case TRY_CONTEXT:
                updateConditional(step, direction, entering);
                break;
            case THEN_BRANCH:
                updateThenBranch(step, direction);
                break;
            case ELSE_BRANCH:
                updateElseBranch(step, direction);
                break;
            case OR_LEFT:
                updateLeftBranch(step, direction);
                break;
            case OR_RIGHT:
                updateRightBranch(step, direction);
                break;
            case SKIP:
            case BREAK:
            case FAIL: {
                String keyword = step.getType().getElementName();
                replaceWithSearch(direction, i -> tokens.get(i).is(ProgramLexeme.KEYWORD, keyword));
                break;
            }
            default:
                // Matches, applications, conditions and or-contexts have no token of their own.
                break;
        }
        return getCurrentHighlight();
    }

    /**
     * @return the reference on top of the highlight stack, which may be a position marker
     */
    public TokenReference getCurrentHighlight() {
        return highlights.peek();
    }

    public int getHighlightDepth() {
        return highlights.size();
    }

    public List<Token> getTokens() {
        return tokens;
    }

    private void updateProcedure(TraceStep step, TraceDirection direction, boolean entering) {
        if (!entering) {
            popHighlight();
            return;
        }

        String name = stripPrefix(step.getContextName());
        int origin = searchOrigin(direction);
        int callSite = search(searchStart(direction), direction, i -> isProcedureCall(i, name));
        if (callSite >= 0) {
            replaceCurrent(reference(callSite));
            origin = callSite;
        }

        // Declarations can sit anywhere in the program, so look from the top.
        int declaration = search(0, TraceDirection.FORWARDS,
                i -> tokens.get(i).is(ProgramLexeme.DECLARATION, name) && isDeclaration(i));
        if (declaration < 0) {
            LOG.debug("No declaration found for procedure {}", name);
            pushHighlight(TokenReference.marker(origin));
        } else if (direction == TraceDirection.FORWARDS) {
            pushHighlight(reference(declaration));
        } else {
            // Entering from the end: the body finishes where the next declaration starts.
            int next = search(declaration + 1, TraceDirection.FORWARDS, this::isDeclaration);
            pushHighlight(TokenReference.marker(next >= 0 ? next : tokens.size()));
        }
    }

    private void updateLoop(TraceDirection direction, boolean entering) {
        if (entering) {
            // Anchor where the loop body starts (or ends, going backwards), then a
            // working entry on top of it for the statements of the body.
            int origin = searchOrigin(direction);
            replaceCurrent(TokenReference.marker(origin));
            highlights.push(TokenReference.marker(origin));
            return;
        }
        if (highlights.size() < 2) {
            LOG.warn("Highlight stack has no loop anchor to drop");
            return;
        }
        TokenReference top = highlights.pop();
        highlights.pop();
        highlights.push(top);
    }

    private void restartIteration() {
        if (highlights.size() < 2) {
            return;
        }
        TokenReference top = highlights.pop();
        TokenReference anchor = highlights.peek();
        highlights.push(top);
        replaceCurrent(TokenReference.marker(anchor.index()));
    }

    private void updateConditional(TraceStep step, TraceDirection direction, boolean entering) {
        String keyword = step.getType().getElementName();
        if (direction == TraceDirection.FORWARDS) {
            if (entering) {
                int index = search(searchStart(direction), direction,
                        i -> tokens.get(i).is(ProgramLexeme.KEYWORD, keyword));
                if (index >= 0) {
                    replaceCurrent(reference(index));
                }
                conditionalKeywords.push(index);
            } else if (!conditionalKeywords.isEmpty()) {
                conditionalKeywords.pop();
            }
            return;
        }

        if (entering) {
            conditionalKeywords.push(findEnclosingKeyword(keyword));
        } else {
            int index = conditionalKeywords.isEmpty() ? -1 : conditionalKeywords.pop();
            if (index >= 0) {
                replaceCurrent(reference(index));
            }
        }
    }

    private void updateThenBranch(TraceStep step, TraceDirection direction) {
        int thenIndex = findBranchKeyword("then");
        if (direction == TraceDirection.FORWARDS) {
            if (!step.isEndOfContext()) {
                if (thenIndex < 0) {
                    step.markVirtual();
                } else {
                    replaceCurrent(reference(thenIndex));
                }
                return;
            }
            // Leaving the then-branch: step over the else-branch that was not taken.
            int elseIndex = findBranchKeyword("else");
            if (elseIndex >= 0) {
                replaceCurrent(TokenReference.marker(skipOperandForward(elseIndex + 1)));
            }
            return;
        }

        if (step.isEndOfContext()) {
            int elseIndex = findBranchKeyword("else");
            if (elseIndex >= 0) {
                replaceCurrent(TokenReference.marker(elseIndex));
            }
        } else if (thenIndex >= 0) {
            replaceCurrent(reference(thenIndex));
        }
    }

    private void updateElseBranch(TraceStep step, TraceDirection direction) {
        if (direction == TraceDirection.FORWARDS) {
            if (!step.isEndOfContext()) {
                int elseIndex = findBranchKeyword("else");
                if (elseIndex < 0) {
                    step.markVirtual();
                } else {
                    replaceCurrent(reference(elseIndex));
                }
            }
            return;
        }

        if (!step.isEndOfContext()) {
            // Leaving the else-branch backwards: resume in the condition, skipping the then-branch.
            int thenIndex = findBranchKeyword("then");
            int target = thenIndex >= 0 ? thenIndex : findBranchKeyword("else");
            if (target >= 0) {
                replaceCurrent(TokenReference.marker(target));
            }
        }
    }

    private void updateLeftBranch(TraceStep step, TraceDirection direction) {
        if (!step.isEndOfContext()) {
            return;
        }
        if (direction == TraceDirection.FORWARDS) {
            int orIndex = findOrForward();
            if (orIndex >= 0) {
                replaceCurrent(TokenReference.marker(skipOperandForward(orIndex + 1)));
            }
        } else {
            int orIndex = findOrBackward();
            if (orIndex >= 0) {
                replaceCurrent(TokenReference.marker(orIndex));
            }
        }
    }

    private void updateRightBranch(TraceStep step, TraceDirection direction) {
        if (step.isEndOfContext()) {
            return;
        }
        if (direction == TraceDirection.FORWARDS) {
            int orIndex = findOrForward();
            if (orIndex >= 0) {
                replaceCurrent(reference(orIndex));
            }
        } else {
            int orIndex = findOrBackward();
            if (orIndex >= 0) {
                replaceCurrent(TokenReference.marker(skipOperandBackward(orIndex - 1)));
            }
        }
    }

    /**
     * Forwards, the {@code or} keyword only counts once every parenthesis opened
     * after the current highlight has been closed again. Parentheses that open
     * before the first operand token group the or-statement itself.
     */
    private int findOrForward() {
        int depth = 0;
        int groupDepth = 0;
        boolean leading = true;
        for (int i = searchStart(TraceDirection.FORWARDS); i >= 0 && i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getLexeme() == ProgramLexeme.OPEN_PAREN) {
                depth++;
                if (leading) {
                    groupDepth++;
                }
                continue;
            }
            if (token.getLexeme() != ProgramLexeme.STATEMENT_SEPARATOR) {
                leading = false;
            }
            if (token.getLexeme() == ProgramLexeme.CLOSE_PAREN) {
                depth--;
            } else if (depth <= groupDepth && token.is(ProgramLexeme.KEYWORD, "or")) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Backwards, the nearest {@code or} keyword is taken without looking at parentheses.
     */
    private int findOrBackward() {
        return search(searchStart(TraceDirection.BACKWARDS), TraceDirection.BACKWARDS,
                i -> tokens.get(i).is(ProgramLexeme.KEYWORD, "or"));
    }

    /**
     * Looks for {@code keyword} at parenthesis depth zero in the statement of
     * the innermost if or try, stopping at the end of that statement.
     */
    private int findBranchKeyword(String keyword) {
        Integer anchor = conditionalKeywords.peek();
        int start = anchor != null && anchor >= 0 ? anchor + 1 : searchStart(TraceDirection.FORWARDS);
        int depth = 0;
        for (int i = Math.max(start, 0); i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getLexeme() == ProgramLexeme.OPEN_PAREN) {
                depth++;
            } else if (token.getLexeme() == ProgramLexeme.CLOSE_PAREN) {
                if (depth == 0) {
                    return -1;
                }
                depth--;
            } else if (depth == 0) {
                if (token.is(ProgramLexeme.KEYWORD, keyword)) {
                    return i;
                }
                if (token.getLexeme() == ProgramLexeme.STATEMENT_SEPARATOR || isDeclaration(i)) {
                    return -1;
                }
            }
        }
        return -1;
    }

    private int findEnclosingKeyword(String keyword) {
        int depth = 0;
        for (int i = searchStart(TraceDirection.BACKWARDS); i >= 0 && i < tokens.size(); i--) {
            Token token = tokens.get(i);
            if (token.getLexeme() == ProgramLexeme.CLOSE_PAREN) {
                depth++;
            } else if (token.getLexeme() == ProgramLexeme.OPEN_PAREN) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && token.is(ProgramLexeme.KEYWORD, keyword)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @return the index of the last token of the operand starting at {@code from}
     */
    private int skipOperandForward(int from) {
        int depth = 0;
        int last = from - 1;
        for (int i = from; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (depth == 0 && isOperandBoundary(i)) {
                break;
            }
            if (token.getLexeme() == ProgramLexeme.OPEN_PAREN) {
                depth++;
            } else if (token.getLexeme() == ProgramLexeme.CLOSE_PAREN) {
                if (depth == 0) {
                    break;
                }
                depth--;
            }
            last = i;
        }
        return last;
    }

    /**
     * @return the index of the first token of the operand ending at {@code from}
     */
    private int skipOperandBackward(int from) {
        int depth = 0;
        int first = from + 1;
        for (int i = from; i >= 0; i--) {
            Token token = tokens.get(i);
            if (depth == 0 && (isOperandBoundary(i)
                    || token.getLexeme() == ProgramLexeme.DECLARATION_OPERATOR
                    || token.is(ProgramLexeme.KEYWORD, "if")
                    || token.is(ProgramLexeme.KEYWORD, "try"))) {
                break;
            }
            if (token.getLexeme() == ProgramLexeme.CLOSE_PAREN) {
                depth++;
            } else if (token.getLexeme() == ProgramLexeme.OPEN_PAREN) {
                if (depth == 0) {
                    break;
                }
                depth--;
            }
            first = i;
        }
        return first;
    }

    private boolean isOperandBoundary(int index) {
        Token token = tokens.get(index);
        return token.getLexeme() == ProgramLexeme.STATEMENT_SEPARATOR
                || token.is(ProgramLexeme.KEYWORD, "then")
                || token.is(ProgramLexeme.KEYWORD, "else")
                || token.is(ProgramLexeme.KEYWORD, "or")
                || isDeclaration(index);
    }

    /**
     * A procedure declaration is a declaration token followed by {@code =}; the
     * same name without {@code =} is a call.
     */
    private boolean isDeclaration(int index) {
        return tokens.get(index).getLexeme() == ProgramLexeme.DECLARATION
                && index + 1 < tokens.size()
                && tokens.get(index + 1).getLexeme() == ProgramLexeme.DECLARATION_OPERATOR;
    }

    private boolean isProcedureCall(int index, String name) {
        return tokens.get(index).is(ProgramLexeme.DECLARATION, name) && !isDeclaration(index);
    }

    private String stripPrefix(String name) {
        if (name == null) {
            return null;
        }
        return !compilerPrefix.isEmpty() && name.startsWith(compilerPrefix)
                ? name.substring(compilerPrefix.length())
                : name;
    }

    private void replaceWithSearch(TraceDirection direction, IntPredicate predicate) {
        int index = search(searchStart(direction), direction, predicate);
        if (index >= 0) {
            replaceCurrent(reference(index));
        } else {
            LOG.debug("No matching token found searching {}", direction);
        }
    }

    private int search(int start, TraceDirection direction, IntPredicate predicate) {
        int step = direction == TraceDirection.FORWARDS ? 1 : -1;
        for (int i = start; i >= 0 && i < tokens.size(); i += step) {
            if (predicate.test(i)) {
                return i;
            }
        }
        return -1;
    }

    private int searchStart(TraceDirection direction) {
        if (highlights.isEmpty()) {
            return direction == TraceDirection.FORWARDS ? 0 : tokens.size() - 1;
        }
        return highlights.peek().index() + (direction == TraceDirection.FORWARDS ? 1 : -1);
    }

    /**
     * The index the next search is adjacent to; one past either end when nothing is highlighted.
     */
    private int searchOrigin(TraceDirection direction) {
        if (highlights.isEmpty()) {
            return direction == TraceDirection.FORWARDS ? -1 : tokens.size();
        }
        return highlights.peek().index();
    }

    private TokenReference reference(int index) {
        return new TokenReference(tokens.get(index), index);
    }

    private void finishTrace() {
        clearHighlights();
        if (!highlights.isEmpty()) {
            // Park one past the last highlight so that stepping back finds it again.
            TokenReference last = highlights.pop();
            highlights.push(TokenReference.marker(last.index() + 1));
        }
    }

    private void clearHighlights() {
        tokens.forEach(token -> token.setEmphasised(false));
    }

    private void replaceCurrent(TokenReference reference) {
        if (!highlights.isEmpty()) {
            highlights.pop().setEmphasis(false);
        }
        reference.setEmphasis(true);
        highlights.push(reference);
    }

    private void pushHighlight(TokenReference reference) {
        if (!highlights.isEmpty()) {
            highlights.peek().setEmphasis(false);
        }
        reference.setEmphasis(true);
        highlights.push(reference);
    }

    private void popHighlight() {
        if (highlights.isEmpty()) {
            LOG.warn("Highlight stack is already empty");
            return;
        }
        highlights.pop().setEmphasis(false);
        if (!highlights.isEmpty()) {
            highlights.peek().setEmphasis(true);
        }
    }
}
