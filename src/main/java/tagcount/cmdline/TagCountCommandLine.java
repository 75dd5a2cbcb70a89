package tagcount.cmdline;

import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.barclay.argparser.ClassFinder;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;

/*
 * The MIT License
 *
 * Copyright (c) 2014 The Broad Institute
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */


/**
 * This is the main class of tagcount and is the way of executing individual command line programs.
 *
 * CommandLinePrograms are listed in a single command line interface based on the java package specified to instanceMain.
 */
public class TagCountCommandLine {
    private static String initializeColor(final String color) {
        if (CommandLineDefaults.COLOR_STATUS) return color;
        else return "";
    }

    /** Provides ANSI colors for the terminal output **/
    private final static String KNRM = initializeColor("\u001B[0m"); // reset
    private final static String KRED = initializeColor("\u001B[31m");
    private final static String KGRN = initializeColor("\u001B[32m");
    private final static String KCYN = initializeColor("\u001B[36m");
    private final static String KWHT = initializeColor("\u001B[37m");
    private final static String KBLDRED = initializeColor("\u001B[1m\u001B[31m");

    /** The name of this unified command line program **/
    private final static String COMMAND_LINE_NAME = TagCountCommandLine.class.getSimpleName();

    /** The packages we wish to include in our command line **/
    protected static List<String> getPackageList() {
        final List<String> packageList = new ArrayList<>();
        packageList.add("tagcount");
        return packageList;
    }

    /**
     * The main method.
     *
     * Give a list of java packages in which to search for classes that extend CommandLineProgram.  Those will be included
     * on the command line.
     * **/
    protected int instanceMain(final String[] args, final List<String> packageList, final String commandLineName) {
        final CommandLineProgram program = extractCommandLineProgram(args, packageList, commandLineName);
        if (null == program) return 1; // no program found!
        // lop off the program name, the remaining arguments belong to the program
        final String[] mainArgs = Arrays.copyOfRange(args, 1, args.length);
        return program.instanceMain(mainArgs);
    }

    /** For testing **/
    protected int instanceMain(final String[] args) {
        return instanceMain(args, getPackageList(), COMMAND_LINE_NAME);
    }

    public static void main(final String[] args) {
        System.exit(new TagCountCommandLine().instanceMain(args, getPackageList(), COMMAND_LINE_NAME));
    }

    /** Returns the command line program specified, or prints the usage and returns null **/
    private static CommandLineProgram extractCommandLineProgram(final String[] args, final List<String> packageList, final String commandLineName) {
        final Map<String, Class<?>> simpleNameToClass = new HashMap<>();
        final List<String> missingAnnotationClasses = new ArrayList<>();
        processAllCommandLinePrograms(
                packageList,
                (Class<CommandLineProgram> clazz, CommandLineProgramProperties clProperties) -> {
                    if (null == clProperties) {
                        missingAnnotationClasses.add(clazz.getSimpleName());
                    }
                    else if (!clProperties.omitFromCommandLine()) {
                        if (simpleNameToClass.containsKey(clazz.getSimpleName())) {
                            throw new RuntimeException("Simple class name collision: " + clazz.getSimpleName());
                        }
                        simpleNameToClass.put(clazz.getSimpleName(), clazz);
                    }
                }
        );
        if (!missingAnnotationClasses.isEmpty()) {
            throw new RuntimeException("The following classes are missing the required CommandLineProgramProperties annotation: " +
                    String.join(", ", missingAnnotationClasses));
        }

        if (args.length < 1 || args[0].equals("-h")) {
            printUsage(simpleNameToClass.values(), commandLineName, false);
        } else if (args[0].equals("--list-commands")) {
            printUsage(simpleNameToClass.values(), commandLineName, true);
        } else {
            final Class<?> clazz = simpleNameToClass.get(args[0]);
            if (clazz != null) {
                try {
                    return (CommandLineProgram) clazz.getDeclaredConstructor().newInstance();
                } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
                    throw new RuntimeException(e);
                }
            }
            printUsage(simpleNameToClass.values(), commandLineName, false);
            printUnknown(simpleNameToClass.keySet(), args[0]);
        }
        return null;
    }

    /**
     * Process each {@code CommandLineProgram}-derived class given a list of packages.
     * @param packageList list of packages to search
     * @param clpClassProcessor function to process each CommandLineProgram class found in {@code packageList} (note
     *                          that the {@code CommandLineProgramProperties} argument may be null)
     */
    public static void processAllCommandLinePrograms(
            final List<String> packageList,
            final BiConsumer<Class<CommandLineProgram>, CommandLineProgramProperties> clpClassProcessor) {
        final ClassFinder classFinder = new ClassFinder();
        packageList.forEach(pkg -> classFinder.find(pkg, CommandLineProgram.class));

        for (final Class clazz : classFinder.getClasses()) {
            // No interfaces, synthetic, primitive, local, or abstract classes.
            if (!clazz.isInterface() && !clazz.isSynthetic() && !clazz.isPrimitive() && !clazz.isLocalClass()
                    && !Modifier.isAbstract(clazz.getModifiers())) {
                clpClassProcessor.accept(clazz, getProgramProperty(clazz));
            }
        }
    }

    public static CommandLineProgramProperties getProgramProperty(final Class<?> clazz) {
        return clazz.getAnnotation(CommandLineProgramProperties.class);
    }

    private static void printUsage(final Iterable<Class<?>> classes, final String commandLineName, final boolean commandListOnly) {
        final StringBuilder builder = new StringBuilder();
        if (!commandListOnly) {
            builder.append(KBLDRED + "USAGE: " + commandLineName + " " + KGRN + "<program name>" + KBLDRED + " [-h]\n\n" + KNRM);
            builder.append(KBLDRED + "Available Programs:\n" + KNRM);
        }

        /** Group CommandLinePrograms by CommandLineProgramGroup **/
        final Map<Class<? extends CommandLineProgramGroup>, CommandLineProgramGroup> groupInstances = new HashMap<>();
        final Map<CommandLineProgramGroup, List<Class<?>>> programsByGroup = new TreeMap<>(CommandLineProgramGroup.comparator);
        for (final Class<?> clazz : classes) {
            final CommandLineProgramProperties property = getProgramProperty(clazz);
            CommandLineProgramGroup programGroup = groupInstances.get(property.programGroup());
            if (null == programGroup) {
                try {
                    programGroup = property.programGroup().getDeclaredConstructor().newInstance();
                } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
                    throw new RuntimeException(e);
                }
                groupInstances.put(property.programGroup(), programGroup);
            }
            programsByGroup.computeIfAbsent(programGroup, g -> new ArrayList<>()).add(clazz);
        }

        for (final Map.Entry<CommandLineProgramGroup, List<Class<?>>> entry : programsByGroup.entrySet()) {
            final CommandLineProgramGroup programGroup = entry.getKey();

            if (!commandListOnly) {
                builder.append(KWHT + "--------------------------------------------------------------------------------------\n" + KNRM);
                builder.append(String.format("%s%-48s %-45s%s\n", KRED, programGroup.getName() + ":", programGroup.getDescription(), KNRM));
            }

            final List<Class<?>> sortedClasses = entry.getValue().stream()
                    .sorted(Comparator.comparing(Class::getSimpleName))
                    .collect(Collectors.toList());

            for (final Class<?> clazz : sortedClasses) {
                if (!commandListOnly) {
                    builder.append(String.format("%s    %-45s%s%s%s\n",
                            KGRN, clazz.getSimpleName(), KCYN, getProgramProperty(clazz).oneLineSummary(), KNRM));
                } else {
                    builder.append(clazz.getSimpleName()).append("\n");
                }
            }
            if (!commandListOnly) builder.append("\n");
        }
        if (commandListOnly) {
            System.out.print(builder);
        } else {
            builder.append(KWHT + "--------------------------------------------------------------------------------------\n\n" + KNRM);
            System.err.print(builder);
        }
    }

    /** similarity floor for matching in printUnknown **/
    private final static int HELP_SIMILARITY_FLOOR = 7;
    private final static int MINIMUM_SUBSTRING_LENGTH = 5;

    /** When a command does not match any known command, searches for similar commands, using the same method as GIT **/
    public static void printUnknown(final Set<String> programNames, final String command) {
        final Map<String, Integer> distances = new HashMap<>();

        int bestDistance = Integer.MAX_VALUE;
        int bestN = 0;

        for (final String name : programNames) {
            final int distance;
            if (name.startsWith(command) || (MINIMUM_SUBSTRING_LENGTH <= command.length() && name.contains(command))) {
                distance = 0;
            }
            else {
                distance = StringUtil.levenshteinDistance(command, name, 0, 2, 1, 4);
            }
            distances.put(name, distance);

            if (distance < bestDistance) {
                bestDistance = distance;
                bestN = 1;
            }
            else if (distance == bestDistance) {
                bestN++;
            }
        }

        // Upper bound on the similarity score
        if (0 == bestDistance && bestN == programNames.size()) {
            bestDistance = HELP_SIMILARITY_FLOOR + 1;
        }

        System.err.println(String.format("'%s' is not a valid command. See %s -h for more information.", command, COMMAND_LINE_NAME));
        if (bestDistance < HELP_SIMILARITY_FLOOR) {
            System.err.println(String.format("Did you mean %s?", (bestN < 2) ? "this" : "one of these"));
            for (final String name : programNames) {
                if (bestDistance == distances.get(name)) {
                    System.err.println(String.format("        %s", name));
                }
            }
        }
    }
}
