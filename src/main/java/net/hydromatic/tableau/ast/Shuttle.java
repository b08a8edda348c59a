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

import java.util.ArrayList;
import java.util.List;

/** Visits and transforms syntax trees.
 *
 * <p>Each method returns the node unchanged if none of its descendants
 * changed. */
public class Shuttle {
  protected <E extends AstNode> List<E> visitList(List<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list;
  }

  // leaves

  protected Ast.Exp visit(Ast.Literal literal) {
    return literal; // leaf
  }

  protected Ast.Exp visit(Ast.SymbolicKey key) {
    return key; // leaf
  }

  protected Ast.Exp visit(Ast.Wildcard wildcard) {
    return wildcard; // leaf
  }

  protected Ast.Exp visit(Ast.VariableRef variableRef) {
    return variableRef.copy(visitList(variableRef.indices));
  }

  protected Ast.Exp visit(Ast.Lookup lookup) {
    return lookup.copy(lookup.container.accept(this),
        lookup.key.accept(this));
  }

  // arithmetic and comparisons

  protected Ast.Exp visit(Ast.BinaryOp binaryOp) {
    return binaryOp.copy(binaryOp.left.accept(this),
        binaryOp.right.accept(this));
  }

  protected Ast.Exp visit(Ast.Negate negate) {
    return negate.copy(negate.exp.accept(this));
  }

  protected Ast.Exp visit(Ast.Comparison comparison) {
    return comparison.copy(comparison.left.accept(this),
        comparison.right.accept(this));
  }

  // functions

  protected Ast.Exp visit(Ast.Sum sum) {
    return sum.copy(visitList(sum.args));
  }

  protected Ast.Exp visit(Ast.GeneratorSum generatorSum) {
    return generatorSum.copy(generatorSum.body.accept(this),
        visitList(generatorSum.qualifiers));
  }

  protected Ast.Exp visit(Ast.Abs abs) {
    return abs.copy(abs.exp.accept(this));
  }

  protected Ast.Exp visit(Ast.Call call) {
    return call.copy(visitList(call.args));
  }

  protected Ast.Exp visit(Ast.Not not) {
    return not.copy(not.exp.accept(this));
  }

  protected Ast.Exp visit(Ast.If anIf) {
    return anIf.copy(anIf.condition.accept(this),
        anIf.ifTrue.accept(this), anIf.ifFalse.accept(this));
  }

  protected Ast.Exp visit(Ast.PiecewiseLinear piecewiseLinear) {
    return piecewiseLinear.copy(piecewiseLinear.exp.accept(this));
  }

  protected Ast.Exp visit(Ast.PatternInstanceSet patternInstanceSet) {
    return patternInstanceSet.copy(patternInstanceSet.pattern.accept(this));
  }

  // domains and qualifiers

  protected Ast.Exp visit(Ast.Range range) {
    return range.copy(range.from.accept(this), range.to.accept(this));
  }

  protected Ast.Exp visit(Ast.ListExp list) {
    return list.copy(visitList(list.args));
  }

  protected Ast.Qualifier visit(Ast.Generator generator) {
    return generator.copy(generator.domain.accept(this));
  }

  protected Ast.Qualifier visit(Ast.Filter filter) {
    return filter.copy(filter.condition.accept(this));
  }

  // declarations

  protected Ast.Decl visit(Ast.VarDecl varDecl) {
    return varDecl.copy(visitList(varDecl.qualifiers));
  }

  protected Ast.Decl visit(Ast.ConstraintDecl constraintDecl) {
    return constraintDecl.copy(visitList(constraintDecl.qualifiers),
        (Ast.Comparison) constraintDecl.comparison.accept(this));
  }

  protected Ast.Decl visit(Ast.ObjectiveDecl objectiveDecl) {
    return objectiveDecl.copy(objectiveDecl.exp.accept(this));
  }
}

// End Shuttle.java
