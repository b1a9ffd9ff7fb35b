// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The tokenizer and the reader: conversion of source text into a sequence of top-level {@link gisp.sexp.Sexp}s.
 */
@NonNullByDefault
package gisp.sexp.reader;

import gisp.util.annotation.NonNullByDefault;
