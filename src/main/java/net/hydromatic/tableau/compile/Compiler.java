/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.tableau.compile;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import net.hydromatic.tableau.ast.Ast;
import net.hydromatic.tableau.ast.AstNode;
import net.hydromatic.tableau.model.Model;
import net.hydromatic.tableau.model.ModelAssembler;
import net.hydromatic.tableau.model.Polynomial;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Compiles declarations into a {@link Model}.
 *
 * <p>Each declaration is compiled into its own
 * {@link ModelAssembler.Delta}, which is committed only if the whole
 * declaration compiles; a declaration that fails leaves the model as it
 * was. */
public class Compiler {
  private static final Logger LOGGER = LoggerFactory.getLogger(Compiler.class);

  /** Matches a placeholder such as "{@code {food}}" in a name or
   * description. */
  private static final Pattern PLACEHOLDER =
      Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)}");

  private final Model model;
  private final ConstantEvaluator evaluator;

  public Compiler(Model model, Map<String, ?> parameters) {
    this.model = requireNonNull(model);
    this.evaluator = new ConstantEvaluator(parameters);
  }

  public Model model() {
    return model;
  }

  public ConstantEvaluator evaluator() {
    return evaluator;
  }

  /** Compiles a declarative block. A second objective is an error. */
  public void define(List<? extends Ast.Decl> decls) {
    compileAll(model.define(), decls, Environments.empty());
  }

  /** Compiles declarations that modify the model. A second objective
   * replaces the first. */
  public void modify(List<? extends Ast.Decl> decls) {
    compileAll(model.modify(), decls, Environments.empty());
  }

  /** Compiles declarations in order. Declarations before a failing
   * declaration remain in the model. */
  public void compileAll(ModelAssembler assembler,
      List<? extends Ast.Decl> decls, Environment env) {
    for (Ast.Decl decl : decls) {
      compile(assembler, decl, env);
    }
  }

  /** Compiles a declaration, and commits its variables, constraints and
   * objective to the model. */
  public void compile(ModelAssembler assembler, Ast.Decl decl,
      Environment env) {
    final ModelAssembler.Delta delta = assembler.begin();
    final PolynomialBuilder builder = new PolynomialBuilder(evaluator, delta);
    switch (decl.op) {
    case VAR_DECL:
      compileVarDecl((Ast.VarDecl) decl, env, delta);
      break;
    case CONSTRAINT_DECL:
      compileConstraintDecl((Ast.ConstraintDecl) decl, env, delta, builder);
      break;
    case OBJECTIVE_DECL:
      final Ast.ObjectiveDecl objectiveDecl = (Ast.ObjectiveDecl) decl;
      final Polynomial polynomial = builder.build(objectiveDecl.exp, env);
      delta.setObjective(polynomial, objectiveDecl.direction);
      break;
    default:
      throw new AssertionError("unknown declaration " + decl.op);
    }
    delta.commit();
    LOGGER.debug("Compiled '{}': {} variables, {} constraints", decl,
        delta.variables().size(), delta.constraints().size());
  }

  private void compileVarDecl(Ast.VarDecl varDecl, Environment env,
      ModelAssembler.Delta delta) {
    for (Environment env2
        : Generators.enumerate(varDecl.qualifiers, env, evaluator)) {
      final List<Object> indices = generatorValues(varDecl.qualifiers, env2);
      final String description = varDecl.description == null
          ? null
          : interpolate(varDecl.description, env2, varDecl);
      delta.declareVariable(varDecl.family, indices, varDecl.options,
          description);
    }
  }

  private void compileConstraintDecl(Ast.ConstraintDecl constraintDecl,
      Environment env, ModelAssembler.Delta delta,
      PolynomialBuilder builder) {
    final Ast.Comparison comparison = constraintDecl.comparison;
    for (Environment env2
        : Generators.enumerate(constraintDecl.qualifiers, env, evaluator)) {
      final String name = constraintName(constraintDecl, env2, delta);
      final Polynomial left = builder.build(comparison.left, env2);
      final Polynomial right = builder.build(comparison.right, env2);
      delta.declareConstraint(name, left, comparison.op, right);
    }
  }

  /** Returns the name of a constraint in a given binding.
   *
   * <p>A template with placeholders, such as "{@code cap_{i}}", is
   * interpolated. A template without placeholders gets the values of the
   * generators appended, as in "{@code cap(1,2)}". Without a template, the
   * template is "{@code c<n>}", where {@code n} is the same for every
   * declaration of the same comparison; so declaring a constraint again
   * over the same values is a duplicate, as in "{@code c3(1,2)}". */
  private String constraintName(Ast.ConstraintDecl constraintDecl,
      Environment env, ModelAssembler.Delta delta) {
    String template = constraintDecl.name;
    if (template == null) {
      template = "c" + delta.nameGenerator()
          .ordinal("c", constraintDecl.comparison.toString());
    } else if (PLACEHOLDER.matcher(template).find()) {
      return interpolate(template, env, constraintDecl);
    }
    final List<Object> values =
        generatorValues(constraintDecl.qualifiers, env);
    if (values.isEmpty()) {
      return template;
    }
    return values.stream()
        .map(Keys::text)
        .collect(Collectors.joining(",", template + "(", ")"));
  }

  /** Returns the values of the generators in a list of qualifiers, in
   * declaration order. */
  private static List<Object> generatorValues(
      List<Ast.Qualifier> qualifiers, Environment env) {
    final List<Object> values = new ArrayList<>();
    for (Ast.Qualifier qualifier : qualifiers) {
      if (qualifier instanceof Ast.Generator) {
        final String name = ((Ast.Generator) qualifier).name;
        values.add(requireNonNull(env.getValue(name), name));
      }
    }
    return values;
  }

  /** Replaces each placeholder "{@code {name}}" in a template with the
   * value bound to {@code name}.
   *
   * @throws UnboundSymbolException if a name is not bound */
  static String interpolate(String template, Environment env,
      @Nullable AstNode node) {
    final Matcher matcher = PLACEHOLDER.matcher(template);
    final StringBuilder b = new StringBuilder();
    int end = 0;
    while (matcher.find()) {
      final String name = matcher.group(1);
      final Object value = env.getValue(name);
      if (value == null) {
        throw new UnboundSymbolException(name, node);
      }
      b.append(template, end, matcher.start()).append(Keys.text(value));
      end = matcher.end();
    }
    return b.append(template.substring(end)).toString();
  }
}

// End Compiler.java
