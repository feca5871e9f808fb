package com.challenges.treenav.tree;

@FunctionalInterface
public interface NodeVisitor<E> {
    Visit visit(TreeNode<E> node) throws TreeSearchException;
}
