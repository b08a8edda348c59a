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
package net.hydromatic.tableau.ast;

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // leaves

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.SymbolicKey key) {}

  protected void visit(Ast.Wildcard wildcard) {}

  protected void visit(Ast.VariableRef variableRef) {
    variableRef.indices.forEach(this::accept);
  }

  protected void visit(Ast.Lookup lookup) {
    lookup.container.accept(this);
    lookup.key.accept(this);
  }

  // arithmetic and comparisons

  protected void visit(Ast.BinaryOp binaryOp) {
    binaryOp.left.accept(this);
    binaryOp.right.accept(this);
  }

  protected void visit(Ast.Negate negate) {
    negate.exp.accept(this);
  }

  protected void visit(Ast.Comparison comparison) {
    comparison.left.accept(this);
    comparison.right.accept(this);
  }

  // functions

  protected void visit(Ast.Sum sum) {
    sum.args.forEach(this::accept);
  }

  protected void visit(Ast.GeneratorSum generatorSum) {
    generatorSum.qualifiers.forEach(this::accept);
    generatorSum.body.accept(this);
  }

  protected void visit(Ast.Abs abs) {
    abs.exp.accept(this);
  }

  protected void visit(Ast.Call call) {
    call.args.forEach(this::accept);
  }

  protected void visit(Ast.Not not) {
    not.exp.accept(this);
  }

  protected void visit(Ast.If anIf) {
    anIf.condition.accept(this);
    anIf.ifTrue.accept(this);
    anIf.ifFalse.accept(this);
  }

  protected void visit(Ast.PiecewiseLinear piecewiseLinear) {
    piecewiseLinear.exp.accept(this);
  }

  protected void visit(Ast.PatternInstanceSet patternInstanceSet) {
    patternInstanceSet.pattern.accept(this);
  }

  // domains and qualifiers

  protected void visit(Ast.Range range) {
    range.from.accept(this);
    range.to.accept(this);
  }

  protected void visit(Ast.ListExp list) {
    list.args.forEach(this::accept);
  }

  protected void visit(Ast.Generator generator) {
    generator.domain.accept(this);
  }

  protected void visit(Ast.Filter filter) {
    filter.condition.accept(this);
  }

  // declarations

  protected void visit(Ast.VarDecl varDecl) {
    varDecl.qualifiers.forEach(this::accept);
  }

  protected void visit(Ast.ConstraintDecl constraintDecl) {
    constraintDecl.qualifiers.forEach(this::accept);
    constraintDecl.comparison.accept(this);
  }

  protected void visit(Ast.ObjectiveDecl objectiveDecl) {
    objectiveDecl.exp.accept(this);
  }
}

// End Visitor.java
