// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.cryptarithm.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Model of a cryptarithmetic puzzle: {@code operand_1 + ... + operand_n = answer} in a given base.
 *
 * <p>Every distinct symbol of the operands and the answer is a variable. Variables receive dense
 * indices {@code 0..n-1} in order of first occurrence, operands first and answer last. Words are
 * stored as arrays of these indices, most significant symbol first.
 *
 * <p>Replacing the operands, the answer or the leading-zero rule rebuilds the variables and their
 * initial domains from scratch.
 */
public final class CryptarithmProblem {
  static class CryptarithmProblemException extends IllegalArgumentException {
    public CryptarithmProblemException(String methodName, String msg) {
      super(methodName + ": " + msg);
    }
  }

  /** Exception thrown when the operands, the answer or the base cannot describe a puzzle. */
  public static class InvalidProblemException extends CryptarithmProblemException {
    public InvalidProblemException(String methodName, String msg) {
      super(methodName, msg);
    }
  }

  public static final int DEFAULT_BASE = 10;

  /** Creates a decimal puzzle. */
  public CryptarithmProblem(List<String> operands, String answer) {
    this(operands, answer, DEFAULT_BASE);
  }

  /** Creates a puzzle in the given base. Leading zeros are allowed. */
  public CryptarithmProblem(List<String> operands, String answer, int base) {
    if (base <= 0) {
      throw new InvalidProblemException("CryptarithmProblem", "base must be positive, got " + base);
    }
    this.base = base;
    this.forbidLeadingZeros = false;
    rebuild(
        "CryptarithmProblem",
        copyOperands("CryptarithmProblem", operands),
        checkWord("CryptarithmProblem", answer, "answer"));
  }

  /** Replaces the operand words. */
  public void setOperands(List<String> operands) {
    rebuild("setOperands", copyOperands("setOperands", operands), answer);
  }

  /** Replaces the answer word. */
  public void setAnswer(String answer) {
    rebuild("setAnswer", operands, checkWord("setAnswer", answer, "answer"));
  }

  /**
   * Enables the usual puzzle rule that a word of two or more symbols may not start with zero. It
   * is off by default.
   */
  public void setForbidLeadingZeros(boolean forbidLeadingZeros) {
    this.forbidLeadingZeros = forbidLeadingZeros;
    rebuild("setForbidLeadingZeros", operands, answer);
  }

  private static List<String> copyOperands(String methodName, List<String> operands) {
    if (operands == null || operands.isEmpty()) {
      throw new InvalidProblemException(methodName, "at least one operand is required");
    }
    List<String> copy = new ArrayList<>(operands.size());
    for (int i = 0; i < operands.size(); ++i) {
      copy.add(checkWord(methodName, operands.get(i), "operand #" + i));
    }
    return Collections.unmodifiableList(copy);
  }

  private static String checkWord(String methodName, String word, String what) {
    if (word == null || word.isEmpty()) {
      throw new InvalidProblemException(methodName, what + " must be a non-empty word");
    }
    return word;
  }

  private void rebuild(String methodName, List<String> newOperands, String newAnswer) {
    int maxLength = newAnswer.length();
    for (String operand : newOperands) {
      maxLength = Math.max(maxLength, operand.length());
    }
    long[] newPowers = computePowers(methodName, maxLength, newOperands.size());

    operands = newOperands;
    answer = newAnswer;
    powers = newPowers;
    Map<Character, Integer> indices = new LinkedHashMap<>();
    operandWords = new int[operands.size()][];
    for (int i = 0; i < operands.size(); ++i) {
      operandWords[i] = index(operands.get(i), indices);
    }
    answerWord = index(answer, indices);

    letters = new char[indices.size()];
    for (Map.Entry<Character, Integer> entry : indices.entrySet()) {
      letters[entry.getValue()] = entry.getKey();
    }
    letterIndices = indices;

    leadingLetters = new boolean[letters.length];
    for (int[] word : operandWords) {
      markLeadingLetter(word);
    }
    markLeadingLetter(answerWord);

    initialDomains = new Domains(letters.length, base);
    if (forbidLeadingZeros) {
      for (int var = 0; var < letters.length; ++var) {
        if (leadingLetters[var]) {
          initialDomains.remove(var, 0);
        }
      }
    }
  }

  private static int[] index(String word, Map<Character, Integer> indices) {
    int[] result = new int[word.length()];
    for (int i = 0; i < word.length(); ++i) {
      char c = word.charAt(i);
      Integer var = indices.get(c);
      if (var == null) {
        var = indices.size();
        indices.put(c, var);
      }
      result[i] = var;
    }
    return result;
  }

  private void markLeadingLetter(int[] word) {
    if (word.length > 1) {
      leadingLetters[word[0]] = true;
    }
  }

  // Sums of up to numOperands + 1 words of maxLength digits must fit in a long.
  private long[] computePowers(String methodName, int maxLength, int numOperands) {
    long[] result = new long[maxLength];
    try {
      long power = 1;
      for (int i = 0; i < maxLength; ++i) {
        result[i] = power;
        power = Math.multiplyExact(power, base);
      }
      Math.multiplyExact(power, (long) numOperands + 1);
    } catch (ArithmeticException e) {
      throw new InvalidProblemException(
          methodName, "words of " + maxLength + " symbols overflow base " + base);
    }
    return result;
  }

  /** Returns the arithmetic base. */
  public int base() {
    return base;
  }

  /** Returns the operand words, in order. */
  public List<String> operands() {
    return operands;
  }

  /** Returns the answer word. */
  public String answer() {
    return answer;
  }

  public boolean forbidLeadingZeros() {
    return forbidLeadingZeros;
  }

  /** Returns the number of distinct symbols. */
  public int numVariables() {
    return letters.length;
  }

  /** Returns the symbol of the given variable. */
  public char letter(int var) {
    return letters[var];
  }

  /** Returns the variable index of a symbol, or -1 if the symbol does not occur in the puzzle. */
  public int indexOf(char letter) {
    Integer var = letterIndices.get(letter);
    return var == null ? -1 : var;
  }

  public int numOperands() {
    return operandWords.length;
  }

  /** Returns a copy of the variable indices of an operand, most significant first. */
  public int[] operandWord(int i) {
    return operandWords[i].clone();
  }

  /** Returns a copy of the variable indices of the answer, most significant first. */
  public int[] answerWord() {
    return answerWord.clone();
  }

  /** Returns {@code base^position}. */
  public long power(int position) {
    return powers[position];
  }

  /** Returns true if the variable starts a word of two or more symbols. */
  public boolean isLeadingLetter(int var) {
    return leadingLetters[var];
  }

  /**
   * Returns true if there are no more variables than digits. A puzzle failing this test has no
   * solution.
   */
  public boolean hasEnoughDigits() {
    return letters.length <= base;
  }

  /** Returns a fresh copy of the candidate domains every search starts from. */
  public Domains initialDomains() {
    return initialDomains.copy();
  }

  /** Renders a partial assignment as {@code {S=9, E=?, ...}}. */
  public String describe(Assignment assignment) {
    StringBuilder builder = new StringBuilder("{");
    for (int var = 0; var < letters.length; ++var) {
      if (var > 0) {
        builder.append(", ");
      }
      builder.append(letters[var]).append('=');
      if (assignment.isAssigned(var)) {
        builder.append(assignment.value(var));
      } else {
        builder.append('?');
      }
    }
    return builder.append('}').toString();
  }

  @Override
  public String toString() {
    return String.join(" + ", operands) + " = " + answer + " (base " + base + ")";
  }

  private final int base;
  private List<String> operands;
  private String answer;
  private boolean forbidLeadingZeros;

  private char[] letters;
  private Map<Character, Integer> letterIndices;
  private int[][] operandWords;
  private int[] answerWord;
  private long[] powers;
  private boolean[] leadingLetters;
  private Domains initialDomains;
}
