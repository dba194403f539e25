/**
 * Command-line front end ({@code cli} profile): argument parsing, input from arguments or
 * standard input, plain or JSON output, exit codes.
 */
package com.phillippitts.fonemas.cli;
