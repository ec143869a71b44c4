package com.mvccdb.backend.statement;

public class Commit {
}
